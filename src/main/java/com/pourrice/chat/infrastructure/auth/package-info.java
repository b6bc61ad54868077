/**
 * Identity and token adapters used by the console client, where credentials come from configuration.
 */
package com.pourrice.chat.infrastructure.auth;
