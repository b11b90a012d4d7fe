package ai.statues;

/**
 * Base of every error raised by the evaluation core. Errors are raised
 * synchronously where they are detected and are never retried: evaluation is
 * exact and deterministic, so a retry would reproduce the same error.
 */
public class StatuesException extends RuntimeException {
  private static final long serialVersionUID = 4187204562387650017L;

  public StatuesException(final String message) {
    super(message);
  }

  public StatuesException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
