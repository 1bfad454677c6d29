package ca.gc.cra.hostbridge.domain.protocol;

import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import java.util.Objects;

/**
 * One response line. Exactly one of {@code result} or {@code error} is meaningful.
 *
 * <p>A success may carry a {@code null} result; a failure always carries a message and an {@link ErrorKind}.</p>
 *
 * @param id correlation token copied from the request (string or number), or {@code null}
 * @param success whether the command completed
 * @param result handler result (success only)
 * @param error human-readable message (failure only)
 * @param errorKind failure category (failure only)
 */
public record CommandResponse(Object id, boolean success, Object result, String error, ErrorKind errorKind) {

  public CommandResponse {
    CorrelationIds.requireScalar(id);
    if (success) {
      if (error != null || errorKind != null) {
        throw new IllegalArgumentException("successful response must not carry an error");
      }
    } else {
      Objects.requireNonNull(error, "error");
      Objects.requireNonNull(errorKind, "errorKind");
      if (result != null) {
        throw new IllegalArgumentException("failed response must not carry a result");
      }
    }
  }

  public static CommandResponse success(Object id, Object result) {
    return new CommandResponse(id, true, result, null, null);
  }

  public static CommandResponse failure(Object id, ErrorKind kind, String message) {
    String text = message == null || message.isBlank() ? kind.name() : message;
    return new CommandResponse(id, false, null, text, kind);
  }
}
