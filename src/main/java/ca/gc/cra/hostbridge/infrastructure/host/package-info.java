/**
 * Single-threaded host loop that owns the scene graph.
 */
package ca.gc.cra.hostbridge.infrastructure.host;
