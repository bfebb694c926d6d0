package blockgen.blocks;

/**
 * Text sink with naming context for one block inside one generated C function.
 * Expressions returned here are already valid in the function being emitted.
 */
public interface CEmitter {

  /** Whole value of input port; "0.0" if the port is unconnected. */
  String input(int port);

  /** Element k of an input; scalars are broadcast, unconnected ports read as 0.0. */
  String inputElement(int port, int k);

  /** Lvalue of output k. */
  String output(int k);

  /** Lvalue of element of output k. */
  String outputElement(int k, int element);

  String state(int i);

  String derivative(int i);

  /** Simulation time in the current function. */
  String time();

  /** Field of the model inputs or outputs struct belonging to a port block. */
  String externalPort();

  /** File-scope identifier unique to this block, e.g. for constant tables. */
  String uniqueIdentifier(String suffix);

  void line(String text);

  /** Opens a brace block, e.g. open("if (x)") emits "if (x) {". */
  void open(String header);

  void close();

  /** Registers a file-scope helper once per generated source, keyed by name. */
  void requireHelper(String key, String code);

  void warn(String message);
}
