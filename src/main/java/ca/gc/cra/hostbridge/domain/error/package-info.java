/**
 * Error taxonomy shared by every layer of the bridge.
 */
package ca.gc.cra.hostbridge.domain.error;
