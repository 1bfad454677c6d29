/**
 * Jackson-streaming implementation of the line-delimited JSON envelope codec.
 */
package ca.gc.cra.hostbridge.infrastructure.codec;
