/**
 * Wire-level request and response values, independent of the JSON codec.
 */
package ca.gc.cra.hostbridge.domain.protocol;
