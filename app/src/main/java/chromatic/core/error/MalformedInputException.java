package chromatic.core.error;

/** Raised when a canonical text or a part/element value cannot be turned into a structure. */
public class MalformedInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public MalformedInputException(String message) {
    super(message);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
