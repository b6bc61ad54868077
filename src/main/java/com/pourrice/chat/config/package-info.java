/**
 * Configuration loading and wiring for the chat client.
 * <p>Precedence is CLI &gt; YAML &gt; {@link com.pourrice.chat.config.ChatDefaults}. {@link
 * com.pourrice.chat.config.ChatConfig} validates the merged map and {@link
 * com.pourrice.chat.config.CompositionRoot} turns it into a running {@link com.pourrice.chat.config.ChatRuntime}.</p>
 */
package com.pourrice.chat.config;
