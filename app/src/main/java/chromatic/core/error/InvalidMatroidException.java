package chromatic.core.error;

/** Raised at construction time when a basis family violates the matroid basis axioms. */
public class InvalidMatroidException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidMatroidException(String message) {
    super(message);
  }
}
