/**
 * Event-loop executors for chat sessions.
 * <p><strong>Concurrency:</strong> Each session owns one loop thread; all session state is confined to it.</p>
 */
package com.pourrice.chat.infrastructure.exec;
