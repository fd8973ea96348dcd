/**
 * <strong>Purpose:</strong> Input validation for configuration values and wire fields.
 * <p>Validators throw {@link java.lang.IllegalArgumentException} naming the offending key so the
 * CLI can report it verbatim.</p>
 *
 * @since 0.1.0
 */
package io.pandaproxy.validation;
