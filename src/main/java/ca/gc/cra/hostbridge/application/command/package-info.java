/**
 * <strong>Purpose:</strong> Command registry, typed parameter access and dispatch of decoded envelopes.
 * <p><strong>Concurrency:</strong> The registry and dispatcher are read-only after startup and shared by every
 * session; handlers themselves always run on the host loop thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostbridge.application.command;
