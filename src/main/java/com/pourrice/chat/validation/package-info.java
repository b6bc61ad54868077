/**
 * Input validation helpers shared by configuration loading and the CLI.
 * <p>All helpers are stateless and report failures as {@link java.lang.IllegalArgumentException}.</p>
 */
package com.pourrice.chat.validation;
