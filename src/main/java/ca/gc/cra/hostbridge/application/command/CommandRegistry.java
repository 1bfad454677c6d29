package ca.gc.cra.hostbridge.application.command;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable mapping from case-sensitive command names to handlers.
 * <p><strong>Role:</strong> Built once at startup from {@link CommandModule}s; consulted by the dispatcher before
 * any work is marshaled onto the host loop.</p>
 * <p><strong>Thread-safety:</strong> Read-only after {@link Builder#build()}; shared freely across sessions.</p>
 *
 * @since 0.1.0
 */
public final class CommandRegistry {
  private final Map<String, CommandHandler> handlers;

  private CommandRegistry(Map<String, CommandHandler> handlers) {
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Looks up a handler.
   *
   * @param command command name, matched case-sensitively
   * @return the handler, or empty
   */
  public Optional<CommandHandler> find(String command) {
    return Optional.ofNullable(command == null ? null : handlers.get(command));
  }

  /**
   * Looks up a handler, failing with {@link ErrorKind#UNKNOWN_COMMAND} naming the command.
   *
   * @param command command name
   * @return the handler
   * @throws BridgeException when no handler is registered under {@code command}
   */
  public CommandHandler require(String command) {
    return find(command).orElseThrow(
        () -> new BridgeException(ErrorKind.UNKNOWN_COMMAND, "Unknown command: " + command));
  }

  /** Returns registered names in registration order. */
  public Set<String> names() {
    return handlers.keySet();
  }

  public int size() {
    return handlers.size();
  }

  /** Collects handlers; not thread-safe. */
  public static final class Builder {
    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Registers a handler.
     *
     * @param command command name; letters, digits, {@code . _ $ -}
     * @param handler handler to run
     * @return this builder
     * @throws IllegalStateException when the name is already registered
     */
    public Builder register(String command, CommandHandler handler) {
      String name = Strings.requireIdentifier("command", command);
      Objects.requireNonNull(handler, "handler");
      if (handlers.putIfAbsent(name, handler) != null) {
        throw new IllegalStateException("command already registered: " + name);
      }
      return this;
    }

    /**
     * Lets a module register its handlers.
     *
     * @param module module to install
     * @return this builder
     */
    public Builder install(CommandModule module) {
      Objects.requireNonNull(module, "module").registerInto(this);
      return this;
    }

    public boolean contains(String command) {
      return handlers.containsKey(command);
    }

    public CommandRegistry build() {
      return new CommandRegistry(handlers);
    }
  }
}
