package ca.gc.cra.hostbridge.application.command;

/**
 * A registered command. Runs on the host thread and may freely read and mutate the scene graph.
 */
@FunctionalInterface
public interface CommandHandler {

  /**
   * Handles one request.
   *
   * @param context command name, parameters and cancellation token
   * @return result value, flattened to the wire shape by the dispatcher; may be {@code null}
   * @throws Exception any failure; {@code BridgeException}s keep their kind, anything else is reported as a host
   *     exception with its message forwarded verbatim
   */
  Object handle(CommandContext context) throws Exception;
}
