/**
 * Configuration values and composition root wiring for the bridge CLIs.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI arguments into {@link
 * ca.gc.cra.hostbridge.config.BridgeConfig} and assembling the running bridge.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Hosts are restricted to loopback through {@code ca.gc.cra.hostbridge.validation}.</p>
 */
package ca.gc.cra.hostbridge.config;
