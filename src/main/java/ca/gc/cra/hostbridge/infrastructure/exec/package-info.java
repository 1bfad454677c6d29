/**
 * Thread and executor construction for sessions, the acceptor and the host loop.
 */
package ca.gc.cra.hostbridge.infrastructure.exec;
