package chromatic.core.error;

/**
 * Raised when two operands live on incompatible ground sets: quasi-shuffling set compositions
 * that share elements, or testing stability against a set composition that does not cover the
 * matroid.
 */
public class DomainMismatchException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public DomainMismatchException(String message) {
    super(message);
  }
}
