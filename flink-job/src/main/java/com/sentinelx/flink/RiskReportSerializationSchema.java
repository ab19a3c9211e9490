package com.sentinelx.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelx.core.model.RiskReport;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that writes {@link RiskReport} as the
 * snake_case JSON the collector accepts.
 */
public class RiskReportSerializationSchema implements SerializationSchema<RiskReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RiskReportSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(RiskReport report) {
        try {
            return objectMapper().writeValueAsBytes(report);
        } catch (Exception e) {
            LOG.error("Failed to serialize risk report for session {}: {}",
                    report.getSessionId(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
