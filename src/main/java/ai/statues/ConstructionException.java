package ai.statues;

/**
 * Raised when a distribution cannot be built: no values, duplicated values
 * where uniqueness is required, or a clause set whose guards do not partition
 * the certain case.
 */
public class ConstructionException extends StatuesException {
  private static final long serialVersionUID = -2968207311454318209L;

  public ConstructionException(final String message) {
    super(message);
  }
}
