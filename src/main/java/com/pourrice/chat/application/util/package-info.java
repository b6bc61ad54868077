/**
 * Small shared helpers for the chat application layer.
 */
package com.pourrice.chat.application.util;
