package chromatic.core.error;

/**
 * Raised when well-formed values do not fit together: overlapping blocks, a relabeling that is
 * not a bijection on the ground set, or an element added twice.
 */
public class StructuralViolationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public StructuralViolationException(String message) {
    super(message);
  }
}
