package ai.statues;

/**
 * Raised when an argument lies outside the domain an operation supports, such
 * as a probability outside [0, 1] or a draw larger than the population.
 */
public class DomainException extends StatuesException {
  private static final long serialVersionUID = 1964833420915733712L;

  public DomainException(final String message) {
    super(message);
  }
}
