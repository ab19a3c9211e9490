/**
 * Per-session aggregation of accepted risk reports.
 */
package com.sentinelx.core.aggregate;
