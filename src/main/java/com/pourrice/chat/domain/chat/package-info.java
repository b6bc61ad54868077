/**
 * Chat domain values: messages, rooms, typing indicators, presence, attachments and session states.
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Message bodies are user content; log them through {@code Logs.truncate}.</p>
 */
package com.pourrice.chat.domain.chat;
