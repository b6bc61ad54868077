/**
 * Wire vocabulary of the chat connection: event names, outbound request payloads and inbound acknowledgements.
 * <p>Outbound records redact auth tokens in {@code toString()}.</p>
 */
package com.pourrice.chat.domain.protocol;
