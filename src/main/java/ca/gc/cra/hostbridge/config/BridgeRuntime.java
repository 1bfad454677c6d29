package ca.gc.cra.hostbridge.config;

import ca.gc.cra.hostbridge.application.command.CommandDispatcher;
import ca.gc.cra.hostbridge.infrastructure.host.SingleThreadHostLoop;
import ca.gc.cra.hostbridge.infrastructure.net.BridgeServer;
import java.util.Objects;

/**
 * A started bridge: host loop, dispatcher and listener. Closing stops the listener first so no new sessions
 * open, then stops the loop. Sessions still connected are left to their peers and get
 * {@code HOST_UNAVAILABLE} for later requests.
 */
public final class BridgeRuntime implements AutoCloseable {
  private final SingleThreadHostLoop hostLoop;
  private final CommandDispatcher dispatcher;
  private final BridgeServer server;

  BridgeRuntime(SingleThreadHostLoop hostLoop, CommandDispatcher dispatcher, BridgeServer server) {
    this.hostLoop = Objects.requireNonNull(hostLoop, "hostLoop");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.server = Objects.requireNonNull(server, "server");
  }

  public int port() {
    return server.boundPort();
  }

  public CommandDispatcher dispatcher() {
    return dispatcher;
  }

  public SingleThreadHostLoop hostLoop() {
    return hostLoop;
  }

  public BridgeServer server() {
    return server;
  }

  public boolean isRunning() {
    return server.isRunning() && hostLoop.isRunning();
  }

  @Override
  public void close() {
    server.close();
    hostLoop.close();
  }
}
