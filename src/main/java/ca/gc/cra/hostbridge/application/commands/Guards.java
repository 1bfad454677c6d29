package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import java.util.function.Supplier;

/** Maps scene-graph argument rejections onto {@code INVALID_PARAMS}. */
final class Guards {
  private Guards() {
    // Utility
  }

  static void invalidIfRejected(Runnable mutation) {
    try {
      mutation.run();
    } catch (IllegalArgumentException ex) {
      throw new BridgeException(ErrorKind.INVALID_PARAMS, ex.getMessage(), ex);
    }
  }

  static <T> T valueOrInvalid(Supplier<T> mutation) {
    try {
      return mutation.get();
    } catch (IllegalArgumentException ex) {
      throw new BridgeException(ErrorKind.INVALID_PARAMS, ex.getMessage(), ex);
    }
  }
}
