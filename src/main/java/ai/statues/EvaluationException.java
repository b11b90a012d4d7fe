package ai.statues;

/**
 * Raised while enumerating: table lookup miss, non-boolean guard or logical
 * operand, or a distribution used where a plain boolean is expected.
 */
public class EvaluationException extends StatuesException {
  private static final long serialVersionUID = 5530919216020470213L;

  public EvaluationException(final String message) {
    super(message);
  }
}
