/**
 * Marshaling of command handlers onto the host loop with a bounded wait and cooperative cancellation.
 */
package ca.gc.cra.hostbridge.application.exec;
