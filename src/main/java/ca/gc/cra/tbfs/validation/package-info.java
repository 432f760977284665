/**
 * Input validation helpers shared by configuration and CLI parsing.
 * <p>All helpers are stateless and raise {@link java.lang.IllegalArgumentException} on invalid input.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tbfs.validation;
