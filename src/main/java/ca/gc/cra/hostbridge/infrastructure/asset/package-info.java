/**
 * In-memory {@link ca.gc.cra.hostbridge.application.port.AssetCatalog}.
 */
package ca.gc.cra.hostbridge.infrastructure.asset;
