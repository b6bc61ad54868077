/**
 * HTTP adapter for the image store holding chat attachments.
 * <p><strong>Security:</strong> Bearer tokens are fetched per request and never logged.</p>
 */
package com.pourrice.chat.infrastructure.imagestore;
