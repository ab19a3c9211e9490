/**
 * Collector-side validation of risk reports.
 */
package com.sentinelx.core.validation;
