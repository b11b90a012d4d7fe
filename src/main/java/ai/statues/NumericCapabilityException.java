package ai.statues;

/**
 * Raised when a numeric domain, or the values of a distribution, lack an
 * operation a query requires.
 */
public class NumericCapabilityException extends StatuesException {
  private static final long serialVersionUID = -3326009526160951318L;

  public NumericCapabilityException(final String message) {
    super(message);
  }

  public NumericCapabilityException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
