package ca.gc.cra.hostbridge.infrastructure.net;

import ca.gc.cra.hostbridge.application.command.CommandDispatcher;
import ca.gc.cra.hostbridge.application.port.EnvelopeCodec;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.hostbridge.validation.Net;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loopback TCP listener for the line-delimited JSON protocol.
 * <p><strong>Concurrency:</strong> A daemon acceptor thread hands each accepted connection to its own session
 * thread. Sessions only decode, dispatch and encode; all graph work is marshaled to the host loop by the
 * dispatcher, so any number of sessions may be connected at once.</p>
 * <p><strong>Security:</strong> Binds to a loopback address only and performs no authentication.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} binds (port 0 picks an ephemeral port, see
 * {@link #boundPort()}); {@link #close()} stops accepting and leaves open sessions to end when their peer
 * disconnects. {@link #disconnectAll()} drops them immediately.</p>
 *
 * @since 0.1.0
 */
public final class BridgeServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BridgeServer.class);
  private static final int BACKLOG = 50;

  private final InetAddress bindAddress;
  private final int port;
  private final CommandDispatcher dispatcher;
  private final EnvelopeCodec codec;
  private final MetricsPort metrics;
  private final Set<SessionHandler> sessions = ConcurrentHashMap.newKeySet();
  private final AtomicLong sessionIds = new AtomicLong();

  private ServerSocket serverSocket;
  private ExecutorService sessionPool;
  private Thread acceptor;
  private volatile boolean running;

  /**
   * @param host loopback host to bind
   * @param port port to bind, 0 for ephemeral
   * @param dispatcher request dispatcher
   * @param codec envelope codec
   * @param metrics metrics sink
   */
  public BridgeServer(String host, int port, CommandDispatcher dispatcher, EnvelopeCodec codec, MetricsPort metrics) {
    this.bindAddress = Net.loopbackAddress(host);
    this.port = Net.requirePort(port, true);
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Binds the listener and starts accepting connections.
   *
   * @return this server
   * @throws UncheckedIOException when the port cannot be bound
   * @throws IllegalStateException when already started
   */
  public synchronized BridgeServer start() {
    if (running) {
      throw new IllegalStateException("server already started");
    }
    try {
      serverSocket = new ServerSocket(port, BACKLOG, bindAddress);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to bind " + bindAddress.getHostAddress() + ":" + port, ex);
    }
    sessionPool = ExecutorFactories.newSessionPool("hostbridge-session", null);
    running = true;
    acceptor = ExecutorFactories.newNamedThread("hostbridge-acceptor", this::acceptLoop);
    acceptor.start();
    log.info("Bridge listening on {}:{}", bindAddress.getHostAddress(), serverSocket.getLocalPort());
    return this;
  }

  /**
   * Returns the bound port.
   *
   * @return local port
   * @throws IllegalStateException before {@link #start()}
   */
  public int boundPort() {
    ServerSocket socket = serverSocket;
    if (socket == null) {
      throw new IllegalStateException("server not started");
    }
    return socket.getLocalPort();
  }

  public boolean isRunning() {
    return running;
  }

  public int activeSessions() {
    return sessions.size();
  }

  @Override
  public synchronized void close() {
    if (!running) {
      return;
    }
    running = false;
    try {
      serverSocket.close();
    } catch (IOException ex) {
      log.debug("Error closing listener", ex);
    }
    sessionPool.shutdown();
    log.info("Bridge stopped accepting; {} session(s) still open", sessions.size());
  }

  /**
   * Closes every open session socket. A request in progress on a dropped session gets no response.
   *
   * @return number of sessions closed
   */
  public int disconnectAll() {
    int closed = 0;
    for (SessionHandler session : sessions) {
      session.close();
      closed++;
    }
    if (closed > 0) {
      log.info("Disconnected {} session(s)", closed);
    }
    return closed;
  }

  private void acceptLoop() {
    while (running) {
      Socket socket;
      try {
        socket = serverSocket.accept();
      } catch (SocketException ex) {
        if (!running || serverSocket.isClosed()) {
          break;
        }
        log.warn("Accept failed: {}", ex.getMessage());
        continue;
      } catch (IOException ex) {
        log.warn("Accept failed", ex);
        continue;
      }
      open(socket);
    }
  }

  private void open(Socket socket) {
    try {
      socket.setTcpNoDelay(true);
    } catch (SocketException ex) {
      log.debug("Unable to disable Nagle on client socket", ex);
    }
    SessionHandler session = new SessionHandler(
        sessionIds.incrementAndGet(), socket, dispatcher, codec, metrics, sessions::remove);
    sessions.add(session);
    try {
      sessionPool.execute(session);
    } catch (RejectedExecutionException ex) {
      log.warn("Session pool rejected a connection; closing it");
      sessions.remove(session);
      session.close();
    }
  }
}
