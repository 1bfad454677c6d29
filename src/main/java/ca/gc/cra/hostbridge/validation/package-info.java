/**
 * <strong>Purpose:</strong> Input validation for CLI arguments, YAML settings and registry identifiers.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostbridge.validation;
