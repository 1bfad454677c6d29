/**
 * CLI entry points that start a bridge, probe for one, or send it a single command.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, and hands a validated {@link ca.gc.cra.hostbridge.config.BridgeConfig} to the composition root.</p>
 * <p><strong>Concurrency:</strong> CLI commands run single-threaded during setup; the bridge spawns its own
 * host, acceptor and session threads.</p>
 */
package ca.gc.cra.hostbridge.api;
