package ca.gc.cra.hostbridge.infrastructure.net;

import ca.gc.cra.hostbridge.application.port.EnvelopeCodec;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.hostbridge.validation.Net;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the bridge protocol over one persistent connection. Requests are sent one at a time; each
 * call blocks until its response line arrives or the read timeout elapses.
 *
 * <p>Not thread-safe; use one client per thread.</p>
 */
public final class BridgeClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BridgeClient.class);

  private final Socket socket;
  private final BufferedReader reader;
  private final Writer writer;
  private final EnvelopeCodec codec;

  private BridgeClient(Socket socket, EnvelopeCodec codec) throws IOException {
    this.socket = socket;
    this.codec = codec;
    this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
  }

  /**
   * Connects to a bridge.
   *
   * @param host loopback host
   * @param port bridge port
   * @param connectTimeout connect timeout
   * @param readTimeout per-response read timeout; zero waits forever
   * @return connected client
   * @throws IOException when the connection cannot be established
   */
  public static BridgeClient connect(String host, int port, Duration connectTimeout, Duration readTimeout)
      throws IOException {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(readTimeout, "readTimeout");
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(Net.loopbackAddress(host), Net.requirePort(port, false)),
          (int) connectTimeout.toMillis());
      socket.setSoTimeout((int) readTimeout.toMillis());
      socket.setTcpNoDelay(true);
      return new BridgeClient(socket, new JsonEnvelopeCodec());
    } catch (IOException | RuntimeException ex) {
      socket.close();
      throw ex;
    }
  }

  /**
   * Attempts a fast connect to see whether a bridge is listening.
   *
   * @param host loopback host
   * @param port bridge port
   * @param timeout connect timeout
   * @return {@code true} when a connection was accepted
   */
  public static boolean isReachable(String host, int port, Duration timeout) {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(Net.loopbackAddress(host), Net.requirePort(port, false)),
          (int) Objects.requireNonNull(timeout, "timeout").toMillis());
      return true;
    } catch (IOException ex) {
      log.debug("Bridge at {}:{} not reachable: {}", host, port, ex.getMessage());
      return false;
    }
  }

  /**
   * Sends a command and waits for its response.
   *
   * @param command command name
   * @param params parameters
   * @return decoded response
   * @throws IOException on connection failure, read timeout or a closed connection
   */
  public CommandResponse send(String command, Map<String, Object> params) throws IOException {
    return send(new CommandEnvelope(null, command, params));
  }

  /**
   * Sends an envelope and waits for its response.
   *
   * @param envelope request
   * @return decoded response
   * @throws IOException on connection failure, read timeout or a closed connection
   */
  public CommandResponse send(CommandEnvelope envelope) throws IOException {
    return codec.decodeResponse(sendRaw(codec.encodeRequest(envelope)));
  }

  /**
   * Sends one raw line and returns the raw response line.
   *
   * @param line request line without terminator
   * @return response line
   * @throws IOException on connection failure, read timeout or a closed connection
   */
  public String sendRaw(String line) throws IOException {
    writer.write(line);
    writer.write('\n');
    writer.flush();
    String response = reader.readLine();
    if (response == null) {
      throw new EOFException("Bridge closed the connection");
    }
    return response;
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
