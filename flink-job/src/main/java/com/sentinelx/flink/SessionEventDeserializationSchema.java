package com.sentinelx.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sentinelx.core.model.InteractionEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that turns Kafka bytes into
 * {@link SessionEvent}s.
 *
 * <p>
 * Messages are flat JSON objects: the interaction event fields plus a
 * {@code session_id}, e.g.
 * {@code {"session_id": "abc", "timestamp": 1718000000.2, "type": "key_press"}}.
 * Malformed messages and messages without a session id are logged and
 * dropped (returns {@code null}) so one bad record cannot fail the job.
 * </p>
 */
public class SessionEventDeserializationSchema implements DeserializationSchema<SessionEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SessionEventDeserializationSchema.class);

    static final String SESSION_ID_FIELD = "session_id";

    private transient ObjectMapper mapper;

    @Override
    public SessionEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            JsonNode root = objectMapper().readTree(message);
            if (!(root instanceof ObjectNode node)) {
                LOG.warn("Dropping non-object event message");
                return null;
            }
            JsonNode sessionNode = node.remove(SESSION_ID_FIELD);
            if (sessionNode == null || !sessionNode.isTextual() || sessionNode.asText().isBlank()) {
                LOG.warn("Dropping event without session id");
                return null;
            }
            InteractionEvent event = objectMapper().treeToValue(node, InteractionEvent.class);
            return new SessionEvent(sessionNode.asText(), event);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(SessionEvent nextElement) {
        return false;
    }

    @Override
    public TypeInformation<SessionEvent> getProducedType() {
        return TypeInformation.of(SessionEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
