package blockgen.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Closed set of block kinds a model may contain.
 */
public enum BlockType {
  Sum("sum"),
  Multiply("multiply"),
  Scale("scale"),
  UnaryMinus("unary_minus"),
  Abs("abs"),
  TransferFunction("transfer_function"),
  Source("source"),
  InputPort("input_port"),
  OutputPort("output_port"),
  SignalDisplay("signal_display"),
  SignalLogger("signal_logger"),
  Lookup1D("lookup_1d"),
  Lookup2D("lookup_2d"),
  Evaluate("evaluate"),
  Condition("condition"),
  If("if"),
  Trig("trig"),
  Mux("mux"),
  Demux("demux"),
  DotProduct("dot_product"),
  CrossProduct("cross_product"),
  Magnitude("magnitude"),
  MatrixMultiply("matrix_multiply"),
  Transpose("transpose"),
  /** Structural: replaced by its internal sheets during flattening. */
  Subsystem("subsystem"),
  /** Structural: publishes a named signal inside one scope. */
  SheetLabelSink("sheet_label_sink"),
  /** Structural: consumes a named signal published inside the same scope. */
  SheetLabelSource("sheet_label_source");

  public final String serialName;

  private BlockType(String serialName) { this.serialName = serialName; }

  public static Optional<BlockType> fromSerialName(String serialName) {
    return Stream.of(BlockType.values()).filter(typeVal -> typeVal.serialName.equals(serialName)).findAny();
  }

  /** Sheet labels and subsystems never survive flattening. */
  public boolean isStructural() { return this == Subsystem || this == SheetLabelSink || this == SheetLabelSource; }

  public boolean isSheetLabel() { return this == SheetLabelSink || this == SheetLabelSource; }

  @Override
  public String toString() {
    return serialName;
  }
}
