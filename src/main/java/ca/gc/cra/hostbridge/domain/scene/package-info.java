/**
 * <strong>Purpose:</strong> The live object graph driven by the bridge: a world holding the active scene,
 * entities composed of components, and the built-in component kinds.
 * <p><strong>Concurrency:</strong> Nothing in this package is thread-safe. All instances are confined to the
 * single host loop thread and are only reached through the main-thread executor.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostbridge.domain.scene;
