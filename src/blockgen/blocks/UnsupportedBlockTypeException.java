package blockgen.blocks;

/**
 * Thrown when a block type has no code generation and simulation module.
 */
public class UnsupportedBlockTypeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String blockType;
  private final String blockName;

  public UnsupportedBlockTypeException(String blockType, String blockName) {
    super("Unsupported block type '" + blockType + "' (block " + blockName + ")");
    this.blockType = blockType;
    this.blockName = blockName;
  }

  public String getBlockType() { return blockType; }

  public String getBlockName() { return blockName; }
}
