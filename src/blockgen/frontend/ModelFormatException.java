package blockgen.frontend;

/**
 * Thrown when a model description cannot be turned into sheets.
 */
public class ModelFormatException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ModelFormatException(String message) { super(message); }

  public ModelFormatException(String message, Throwable cause) { super(message, cause); }
}
