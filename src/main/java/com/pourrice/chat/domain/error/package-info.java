/**
 * Checked chat failure taxonomy. History timeouts are not errors; see {@code HistoryOutcome}.
 */
package com.pourrice.chat.domain.error;
