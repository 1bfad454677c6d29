/**
 * Autowiring: locates components by type name, selects a reference field through ranked matchers and assigns
 * it, in best-effort or atomic batches.
 */
package ca.gc.cra.hostbridge.application.wiring;
