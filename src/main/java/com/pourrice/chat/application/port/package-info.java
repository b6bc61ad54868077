/**
 * <strong>Purpose:</strong> Ports between the chat session and its collaborators: transport, scheduler, token and
 * identity providers, image store, UI listener and metrics.
 * <p><strong>Concurrency:</strong> Session-facing callbacks are delivered on the event loop; adapter-facing calls
 * may arrive from any thread.</p>
 * <p><strong>Security:</strong> Tokens flow through {@link com.pourrice.chat.application.port.TokenProvider} per
 * request and are never stored.</p>
 *
 * @since 0.1.0
 */
package com.pourrice.chat.application.port;
