/**
 * Loopback TCP transport: the bridge server, per-connection sessions and a blocking client.
 */
package ca.gc.cra.hostbridge.infrastructure.net;
