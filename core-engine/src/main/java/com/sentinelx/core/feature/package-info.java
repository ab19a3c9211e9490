/**
 * Sliding-window feature extraction over timing-only interaction events.
 */
package com.sentinelx.core.feature;
