package ca.gc.cra.hostbridge.infrastructure.codec;

import ca.gc.cra.hostbridge.application.port.EnvelopeCodec;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Line-oriented JSON codec for the bridge protocol, built on the Jackson streaming API.
 * <p><strong>Requests:</strong> {@code {"id"?: string|number, "command": string, "params"?: object}}. Unknown
 * top-level fields are ignored.</p>
 * <p><strong>Responses:</strong> {@code {"id"?, "result": value}} on success and
 * {@code {"id"?, "error": message, "errorCode": kind}} on failure; never both.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}; one instance
 * serves every session.</p>
 *
 * @since 0.1.0
 */
public final class JsonEnvelopeCodec implements EnvelopeCodec {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public CommandEnvelope decodeRequest(String line) {
    Map<String, Object> root = parseObject(line);
    Object id = root.get("id");
    if (id != null && !(id instanceof String) && !(id instanceof Number)) {
      throw decodeError("'id' must be a string or number");
    }
    Object command = root.get("command");
    if (!(command instanceof String name) || name.isBlank()) {
      throw decodeError(command == null ? "Missing 'command'" : "'command' must be a non-empty string");
    }
    Object params = root.get("params");
    if (params != null && !(params instanceof Map<?, ?>)) {
      throw decodeError("'params' must be an object");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    if (params instanceof Map<?, ?> fields) {
      fields.forEach((key, value) -> typed.put(String.valueOf(key), value));
    }
    return new CommandEnvelope(id, name, typed);
  }

  @Override
  public String encodeResponse(CommandResponse response) {
    Objects.requireNonNull(response, "response");
    return write(generator -> {
      generator.writeStartObject();
      writeId(generator, response.id());
      if (response.success()) {
        generator.writeFieldName("result");
        writeValue(generator, response.result());
      } else {
        generator.writeStringField("error", response.error());
        generator.writeStringField("errorCode", response.errorKind().name());
      }
      generator.writeEndObject();
    });
  }

  @Override
  public String encodeRequest(CommandEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    return write(generator -> {
      generator.writeStartObject();
      writeId(generator, envelope.id());
      generator.writeStringField("command", envelope.command());
      generator.writeFieldName("params");
      writeValue(generator, envelope.params());
      generator.writeEndObject();
    });
  }

  @Override
  public CommandResponse decodeResponse(String line) {
    Map<String, Object> root = parseObject(line);
    Object id = root.get("id");
    Object correlation = id instanceof String || id instanceof Number ? id : null;
    if (root.containsKey("error")) {
      Object message = root.get("error");
      return CommandResponse.failure(correlation, errorKind(root.get("errorCode")),
          message == null ? null : message.toString());
    }
    if (!root.containsKey("result")) {
      throw decodeError("Response carries neither 'result' nor 'error'");
    }
    return CommandResponse.success(correlation, root.get("result"));
  }

  /**
   * Parses any JSON document into maps, lists and scalars.
   *
   * @param json JSON text
   * @return parsed value
   * @throws BridgeException of kind {@link ErrorKind#DECODE} for malformed input or trailing content
   */
  public Object parse(String json) {
    if (json == null || json.isBlank()) {
      throw decodeError("Empty request line");
    }
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw decodeError("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      String detail = ex instanceof JsonProcessingException processing
          ? processing.getOriginalMessage()
          : ex.getMessage();
      throw new BridgeException(ErrorKind.DECODE, "Invalid JSON: " + detail, ex);
    }
  }

  private Map<String, Object> parseObject(String line) {
    Object value = parse(line);
    if (!(value instanceof Map<?, ?> fields)) {
      throw decodeError("Request must be a JSON object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    fields.forEach((key, field) -> map.put(String.valueOf(key), field));
    return map;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw decodeError("Unexpected end of input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw decodeError("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw decodeError("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      list.add(readValue(parser, token));
    }
  }

  private void writeId(JsonGenerator generator, Object id) throws IOException {
    if (id != null) {
      generator.writeFieldName("id");
      writeValue(generator, id);
    }
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      generator.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof List<?> list) {
      generator.writeStartArray();
      for (Object item : list) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else {
      throw new BridgeException(ErrorKind.ENCODE,
          "Cannot encode value of type " + value.getClass().getSimpleName());
    }
  }

  private String write(Writer body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      body.write(generator);
    } catch (IOException ex) {
      throw new BridgeException(ErrorKind.ENCODE, "Failed to encode JSON: " + ex.getMessage(), ex);
    }
    return out.toString();
  }

  private static ErrorKind errorKind(Object code) {
    if (code == null) {
      return ErrorKind.INTERNAL;
    }
    try {
      return ErrorKind.valueOf(code.toString());
    } catch (IllegalArgumentException ex) {
      return ErrorKind.INTERNAL;
    }
  }

  private static BridgeException decodeError(String message) {
    return new BridgeException(ErrorKind.DECODE, message);
  }

  @FunctionalInterface
  private interface Writer {
    void write(JsonGenerator generator) throws IOException;
  }
}
