package ca.gc.cra.hostbridge.application.command;

import ca.gc.cra.hostbridge.application.exec.CancellationToken;
import java.util.Objects;

/**
 * Per-invocation input handed to a {@link CommandHandler}.
 *
 * @param command command name as received
 * @param params typed view over the request parameters
 * @param cancellation signalled when the caller stops waiting
 */
public record CommandContext(String command, CommandParams params, CancellationToken cancellation) {
  public CommandContext {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(cancellation, "cancellation");
  }
}
