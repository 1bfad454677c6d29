/**
 * <strong>Purpose:</strong> Ports separating the bridge's use cases from its adapters: the host loop, the asset
 * catalog, the wire codec and metrics.
 * <p><strong>Concurrency:</strong> Each port documents its own contract; codec and metrics implementations are
 * shared across all session threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostbridge.application.port;
