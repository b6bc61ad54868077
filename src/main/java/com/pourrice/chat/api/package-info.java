/**
 * Command-line entry points.
 * <p>{@link com.pourrice.chat.api.Main} dispatches to {@link com.pourrice.chat.api.ChatCli}, which loads
 * configuration, wires a session and runs a line-oriented console on one restaurant room.</p>
 */
package com.pourrice.chat.api;
