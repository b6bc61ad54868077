/**
 * WebSocket transport and JSON wire codec for the chat connection.
 * <p><strong>Concurrency:</strong> OkHttp delivers callbacks on its own threads; the session re-dispatches them
 * onto its event loop.</p>
 * <p><strong>Observability:</strong> Malformed frames increment {@code chat.frame.malformed}.</p>
 */
package com.pourrice.chat.infrastructure.transport;
