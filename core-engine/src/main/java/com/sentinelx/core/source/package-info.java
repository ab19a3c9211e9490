/**
 * Sources of interaction events for the polling loop.
 *
 * <p>
 * OS-level capture lives outside this module and feeds
 * {@link com.sentinelx.core.source.QueuedEventSource};
 * {@link com.sentinelx.core.source.SyntheticEventSource} generates test
 * traffic.
 * </p>
 */
package com.sentinelx.core.source;
