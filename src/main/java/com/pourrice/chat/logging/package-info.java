/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize chat content before it is logged.
 * <p><strong>Security:</strong> Provides truncation for message bodies and masking for bearer tokens.</p>
 *
 * @since 0.1.0
 */
package com.pourrice.chat.logging;
