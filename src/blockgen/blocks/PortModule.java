package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.util.CText;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shared behavior of input and output port blocks. Top-level ports become fields of the model inputs and outputs
 * structs; ports left inside a subsystem that do not belong to its port list are reported and read as 0.
 */
public abstract class PortModule implements BlockModule {

  public static boolean isExternal(FlattenedBlock block) { return block.nestingDepth() == 0; }

  /** Requested C field name, before deduplication against the other ports of the model. */
  public static String portName(FlattenedBlock block) {
    return CText.sanitizeIdentifier(block.block().getString("portName", block.name()));
  }

  /** Type of the struct field the port maps to. */
  public abstract SignalType externalType(FlattenedBlock block, List<SignalType> inputTypes);

  protected static SignalType declaredType(FlattenedBlock block) {
    String dataType = block.block().getString("dataType", "");
    return dataType.isBlank() ? null : SignalType.parse(dataType);
  }

  @Override
  public Object prepare(FlattenedBlock block, List<SignalType> inputTypes, Consumer<String> warn) {
    if (!isExternal(block))
      warn.accept("Port " + block.flattenedName() + " (" + block.type() + ") is not part of its subsystem's port list and is ignored");
    return null;
  }
}
