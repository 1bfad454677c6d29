package ca.gc.cra.hostbridge.infrastructure.net;

import ca.gc.cra.hostbridge.application.command.CommandDispatcher;
import ca.gc.cra.hostbridge.application.port.EnvelopeCodec;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.logging.Logs;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Serves one client connection: reads request lines, dispatches them and writes one response line each, in
 * order. Decode errors are answered and the session continues; I/O errors end it.
 */
final class SessionHandler implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(SessionHandler.class);
  static final String MDC_SESSION = "session";

  private final long sessionId;
  private final Socket socket;
  private final CommandDispatcher dispatcher;
  private final EnvelopeCodec codec;
  private final MetricsPort metrics;
  private final Consumer<SessionHandler> onClose;

  SessionHandler(
      long sessionId,
      Socket socket,
      CommandDispatcher dispatcher,
      EnvelopeCodec codec,
      MetricsPort metrics,
      Consumer<SessionHandler> onClose) {
    this.sessionId = sessionId;
    this.socket = Objects.requireNonNull(socket, "socket");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  long sessionId() {
    return sessionId;
  }

  @Override
  public void run() {
    MDC.put(MDC_SESSION, Long.toString(sessionId));
    metrics.increment("bridge.session.opened");
    log.info("Client connected from {}", socket.getRemoteSocketAddress());
    try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        Writer writer = new BufferedWriter(
            new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        writer.write(respond(line));
        writer.write('\n');
        writer.flush();
      }
      log.info("Client disconnected");
    } catch (IOException ex) {
      log.debug("Session ended: {}", ex.getMessage());
    } finally {
      close();
      metrics.increment("bridge.session.closed");
      onClose.accept(this);
      MDC.remove(MDC_SESSION);
    }
  }

  /** Closes the socket, unblocking a pending read. */
  void close() {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing session socket", ex);
    }
  }

  String respond(String line) {
    CommandEnvelope envelope;
    try {
      envelope = codec.decodeRequest(line);
    } catch (BridgeException ex) {
      metrics.increment("bridge.decode.failed");
      log.warn("Rejected request {}: {}", Logs.truncate(line, Logs.DEFAULT_ECHO_BYTES), ex.getMessage());
      return codec.encodeResponse(dispatcher.failure(null, ErrorKind.DECODE, ex.getMessage()));
    }
    CommandResponse response = dispatcher.dispatch(envelope);
    try {
      return codec.encodeResponse(response);
    } catch (BridgeException ex) {
      log.warn("Failed to encode result of {}: {}", envelope.command(), ex.getMessage());
      return codec.encodeResponse(CommandResponse.failure(envelope.id(), ErrorKind.ENCODE, ex.getMessage()));
    }
  }
}
