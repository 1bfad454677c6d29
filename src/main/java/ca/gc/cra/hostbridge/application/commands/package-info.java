/**
 * Built-in command modules: host introspection, scene graph, components, properties, assets and game-assembly
 * workflows.
 */
package ca.gc.cra.hostbridge.application.commands;
