package blockgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One block of a sheet. The type is kept as the serial string so that unknown types survive until code generation,
 * where they are reported.
 * Parameters are type specific; a subsystem carries its internal diagram as a list of {@link Sheet} under "sheets".
 */
public record Block(String id, String type, String name, Map<String, Object> parameters) {

  public Block {
    Objects.requireNonNull(id, "block id");
    Objects.requireNonNull(type, "type of block " + id);
    if (name == null)
      name = id;
    parameters = (parameters == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public Block(String id, String type, String name) { this(id, type, name, Map.of()); }

  public Optional<BlockType> GetBlockType() { return BlockType.fromSerialName(type); }

  public boolean isOfType(BlockType blockType) { return blockType.serialName.equals(type); }

  public boolean isSubsystem() { return isOfType(BlockType.Subsystem); }

  public Object getParameter(String key) { return parameters.get(key); }

  public boolean hasParameter(String key) { return parameters.get(key) != null; }

  public String getString(String key, String defaultValue) {
    Object val = parameters.get(key);
    return (val == null) ? defaultValue : val.toString();
  }

  public double getDouble(String key, double defaultValue) {
    Object val = parameters.get(key);
    if (val == null)
      return defaultValue;
    if (val instanceof Number)
      return ((Number)val).doubleValue();
    String text = val.toString().trim();
    if (text.isEmpty())
      return defaultValue;
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Parameter '" + key + "' of block " + name + " is not a number: " + text, e);
    }
  }

  public int getInt(String key, int defaultValue) { return (int)Math.round(getDouble(key, defaultValue)); }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object val = parameters.get(key);
    if (val == null)
      return defaultValue;
    if (val instanceof Boolean)
      return (Boolean)val;
    return Boolean.parseBoolean(val.toString().trim());
  }

  /**
   * Reads a numeric vector parameter. Accepts a list of numbers or a string such as "[1, 2, 3]" or "1 2 3".
   * @return the values, empty if the parameter is missing
   */
  public List<Double> getDoubleList(String key) {
    Object val = parameters.get(key);
    if (val == null)
      return List.of();
    return toDoubleList(key, val);
  }

  /** Reads a numeric matrix parameter given as a list of rows. */
  public List<List<Double>> getDoubleMatrix(String key) {
    Object val = parameters.get(key);
    if (!(val instanceof List))
      return List.of();
    List<List<Double>> rows = new ArrayList<>();
    for (Object row : (List<?>)val)
      rows.add(toDoubleList(key, row));
    return rows;
  }

  public List<String> getStringList(String key) {
    Object val = parameters.get(key);
    if (val == null)
      return List.of();
    if (val instanceof List) {
      List<String> ret = new ArrayList<>();
      for (Object entry : (List<?>)val) {
        if (entry instanceof Map) {
          Object portName = ((Map<?, ?>)entry).get("name");
          ret.add(portName == null ? "" : portName.toString());
        } else
          ret.add(String.valueOf(entry));
      }
      return ret;
    }
    return List.of(val.toString());
  }

  /** Internal sheets of a subsystem; empty for any other block. */
  public List<Sheet> getSubsystemSheets() {
    Object val = parameters.get("sheets");
    if (!(val instanceof List))
      return List.of();
    List<Sheet> ret = new ArrayList<>();
    for (Object entry : (List<?>)val) {
      if (entry instanceof Sheet)
        ret.add((Sheet)entry);
    }
    return ret;
  }

  private List<Double> toDoubleList(String key, Object val) {
    List<Double> ret = new ArrayList<>();
    if (val instanceof List) {
      for (Object entry : (List<?>)val) {
        if (entry instanceof Number)
          ret.add(((Number)entry).doubleValue());
        else
          ret.add(parseNumber(key, entry.toString()));
      }
      return ret;
    }
    if (val instanceof Number)
      return List.of(((Number)val).doubleValue());
    String text = val.toString().replace("[", " ").replace("]", " ").trim();
    if (text.isEmpty())
      return ret;
    for (String part : text.split("[,\\s]+"))
      ret.add(parseNumber(key, part));
    return ret;
  }

  private double parseNumber(String key, String text) {
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Parameter '" + key + "' of block " + name + " contains a non-numeric entry: " + text, e);
    }
  }

  @Override
  public String toString() {
    return name + " (" + type + ")";
  }
}
