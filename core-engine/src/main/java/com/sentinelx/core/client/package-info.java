/**
 * Standalone entry point running monitoring sessions from environment
 * settings.
 */
package com.sentinelx.core.client;
