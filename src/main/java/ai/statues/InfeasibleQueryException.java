package ai.statues;

/**
 * Raised when the total weight collected for a query is zero, i.e. the
 * conditions or observations it was evaluated under cannot hold together.
 */
public class InfeasibleQueryException extends StatuesException {
  private static final long serialVersionUID = -7340265209871637440L;

  public InfeasibleQueryException() {
    super("no value - impossible evidence");
  }

  public InfeasibleQueryException(final String message) {
    super(message);
  }
}
