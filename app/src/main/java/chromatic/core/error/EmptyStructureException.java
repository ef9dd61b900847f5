package chromatic.core.error;

/** Raised by {@code rest()} on an empty composition or set composition. */
public class EmptyStructureException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public EmptyStructureException(String message) {
    super(message);
  }
}
