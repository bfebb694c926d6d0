package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import blockgen.frontend.BlockType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every non-structural block type to its module. Modules are stateless and shared.
 */
public class BlockModuleRegistry {
  private static final Map<BlockType, BlockModule> modules = new EnumMap<>(BlockType.class);

  static {
    for (BlockType type : BlockType.values()) {
      BlockModule module = create(type);
      if (module != null)
        modules.put(type, module);
    }
  }

  private static BlockModule create(BlockType type) {
    switch (type) {
    case Sum:
      return new SumModule();
    case Multiply:
      return new MultiplyModule();
    case Scale:
      return new ScaleModule();
    case UnaryMinus:
      return new UnaryMinusModule();
    case Abs:
      return new AbsModule();
    case TransferFunction:
      return new TransferFunctionModule();
    case Source:
      return new SourceModule();
    case InputPort:
      return new InputPortModule();
    case OutputPort:
      return new OutputPortModule();
    case SignalDisplay:
    case SignalLogger:
      return new SinkModule();
    case Lookup1D:
      return new Lookup1DModule();
    case Lookup2D:
      return new Lookup2DModule();
    case Evaluate:
      return new EvaluateModule();
    case Condition:
      return new ConditionModule();
    case If:
      return new IfModule();
    case Trig:
      return new TrigModule();
    case Mux:
      return new MuxModule();
    case Demux:
      return new DemuxModule();
    case DotProduct:
      return new DotProductModule();
    case CrossProduct:
      return new CrossProductModule();
    case Magnitude:
      return new MagnitudeModule();
    case MatrixMultiply:
      return new MatrixMultiplyModule();
    case Transpose:
      return new TransposeModule();
    case Subsystem:
    case SheetLabelSink:
    case SheetLabelSource:
    default:
      return null;
    }
  }

  public static Optional<BlockModule> GetModule(BlockType type) { return Optional.ofNullable(modules.get(type)); }

  /**
   * @throws UnsupportedBlockTypeException if the type is unknown or structural
   */
  public static BlockModule ResolveModule(FlattenedBlock block) {
    return block.block().GetBlockType().flatMap(BlockModuleRegistry::GetModule)
        .orElseThrow(() -> new UnsupportedBlockTypeException(block.type(), block.flattenedName()));
  }
}
