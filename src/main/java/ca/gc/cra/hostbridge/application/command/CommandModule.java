package ca.gc.cra.hostbridge.application.command;

/**
 * A group of related commands contributed to the registry at startup.
 *
 * <p>New commands are added by writing a module, never by editing the dispatcher.</p>
 */
@FunctionalInterface
public interface CommandModule {

  /**
   * Registers this module's handlers.
   *
   * @param registry builder receiving the handlers
   */
  void registerInto(CommandRegistry.Builder registry);
}
