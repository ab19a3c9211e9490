/**
 * Weighted, smoothed risk scoring.
 */
package com.sentinelx.core.risk;
