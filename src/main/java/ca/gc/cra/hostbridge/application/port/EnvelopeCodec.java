package ca.gc.cra.hostbridge.application.port;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;

/**
 * Converts between single protocol lines and envelope values. Implementations are stateless and shared by
 * every session.
 */
public interface EnvelopeCodec {

  /**
   * Decodes one request line.
   *
   * @param line request line without its terminator
   * @return decoded envelope
   * @throws BridgeException of kind {@code DECODE} for malformed input
   */
  CommandEnvelope decodeRequest(String line);

  /**
   * Encodes a response as one line without a terminator.
   *
   * @param response response to encode
   * @return JSON line
   * @throws BridgeException of kind {@code ENCODE} when the result cannot be serialized
   */
  String encodeResponse(CommandResponse response);

  /**
   * Encodes a request, used by the client side.
   *
   * @param envelope request to encode
   * @return JSON line
   */
  String encodeRequest(CommandEnvelope envelope);

  /**
   * Decodes a response line, used by the client side.
   *
   * @param line response line
   * @return decoded response
   * @throws BridgeException of kind {@code DECODE} for malformed input
   */
  CommandResponse decodeResponse(String line);
}
