/**
 * <strong>Purpose:</strong> Named member access on live components: typed adapters, value coercion and tiered
 * reference resolution.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.hostbridge.application.reflect.ComponentTypeRegistry} is
 * thread-safe; everything that reads or writes components runs on the host loop thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.hostbridge.application.reflect;
