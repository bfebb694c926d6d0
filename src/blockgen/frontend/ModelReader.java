package blockgen.frontend;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a model description (YAML, or JSON as its subset) into sheets.
 * The document is either a list of sheets or a map with "name" and "sheets".
 */
public class ModelReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Model name and its top-level sheets. */
  public record LoadedModel(String name, List<Sheet> sheets) {}

  private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
  private int generatedIds = 0;

  public LoadedModel ReadModel(File modelFile) {
    try (InputStream readFile = new FileInputStream(modelFile)) {
      String fallbackName = modelFile.getName().replaceFirst("\\.[^.]*$", "");
      return Parse(new Yaml().load(readFile), fallbackName);
    } catch (IOException e) {
      throw new ModelFormatException("Model file " + modelFile + " could not be read", e);
    } catch (YAMLException e) {
      throw new ModelFormatException("Model file " + modelFile + " is not valid YAML: " + e.getMessage(), e);
    }
  }

  public LoadedModel ReadModel(String modelText, String fallbackName) {
    try (Reader reader = new StringReader(modelText)) {
      return Parse(new Yaml().load(reader), fallbackName);
    } catch (IOException e) {
      throw new ModelFormatException("Model text could not be read", e);
    } catch (YAMLException e) {
      throw new ModelFormatException("Model text is not valid YAML: " + e.getMessage(), e);
    }
  }

  private LoadedModel Parse(Object document, String fallbackName) {
    inProgress.clear();
    generatedIds = 0;
    if (document instanceof List) {
      return new LoadedModel(fallbackName, ParseSheets(document, "model"));
    }
    if (document instanceof Map) {
      Map<?, ?> docMap = (Map<?, ?>)document;
      Object name = docMap.get("name");
      List<Sheet> sheets = ParseSheets(docMap.get("sheets"), "model");
      logger.debug("Read model '{}' with {} top-level sheet(s)", name, sheets.size());
      return new LoadedModel(name == null ? fallbackName : name.toString(), sheets);
    }
    throw new ModelFormatException("Model document must be a list of sheets or a map with 'sheets'");
  }

  private List<Sheet> ParseSheets(Object sheetsObj, String context) {
    if (sheetsObj == null)
      return List.of();
    if (!(sheetsObj instanceof List))
      throw new ModelFormatException("'sheets' of " + context + " must be a list");
    enter(sheetsObj, context);
    List<Sheet> ret = new ArrayList<>();
    for (Object sheetObj : (List<?>)sheetsObj) {
      Map<?, ?> sheetMap = asMap(sheetObj, "sheet in " + context);
      String id = requireString(sheetMap, "id", "sheet in " + context);
      ret.add(new Sheet(id, optString(sheetMap, "name"), ParseBlocks(sheetMap.get("blocks"), id), ParseConnections(sheetMap.get("connections"), id)));
    }
    inProgress.remove(sheetsObj);
    return ret;
  }

  private List<Block> ParseBlocks(Object blocksObj, String sheetId) {
    List<Block> ret = new ArrayList<>();
    if (blocksObj == null)
      return ret;
    if (!(blocksObj instanceof List))
      throw new ModelFormatException("'blocks' of sheet " + sheetId + " must be a list");
    for (Object blockObj : (List<?>)blocksObj) {
      Map<?, ?> blockMap = asMap(blockObj, "block in sheet " + sheetId);
      String id = requireString(blockMap, "id", "block in sheet " + sheetId);
      String type = requireString(blockMap, "type", "block " + id);
      Map<String, Object> parameters = new LinkedHashMap<>();
      Object paramObj = blockMap.get("parameters");
      if (paramObj != null) {
        enter(paramObj, "block " + id);
        asMap(paramObj, "parameters of block " + id).forEach((key, value) -> parameters.put(key.toString(), value));
        inProgress.remove(paramObj);
      }
      if (BlockType.Subsystem.serialName.equals(type) && parameters.containsKey("sheets"))
        parameters.put("sheets", ParseSheets(parameters.get("sheets"), "subsystem " + id));
      ret.add(new Block(id, type, optString(blockMap, "name"), parameters));
    }
    return ret;
  }

  private List<Connection> ParseConnections(Object connsObj, String sheetId) {
    List<Connection> ret = new ArrayList<>();
    if (connsObj == null)
      return ret;
    if (!(connsObj instanceof List))
      throw new ModelFormatException("'connections' of sheet " + sheetId + " must be a list");
    for (Object connObj : (List<?>)connsObj) {
      Map<?, ?> connMap = asMap(connObj, "connection in sheet " + sheetId);
      String id = optString(connMap, "id");
      if (id == null)
        id = sheetId + "_conn" + (generatedIds++);
      ret.add(new Connection(id, requireString(connMap, "sourceBlockId", "connection " + id), optInt(connMap, "sourcePortIndex", 0),
                             requireString(connMap, "targetBlockId", "connection " + id), optInt(connMap, "targetPortIndex", 0),
                             optString(connMap, "connectionType")));
    }
    return ret;
  }

  private void enter(Object node, String context) {
    if (!inProgress.add(node))
      throw new ModelFormatException("Recursive reference in " + context + "; a subsystem cannot contain itself");
  }

  private static Map<?, ?> asMap(Object obj, String context) {
    if (!(obj instanceof Map))
      throw new ModelFormatException("Expected a map for " + context + ", got " + (obj == null ? "null" : obj.getClass().getSimpleName()));
    return (Map<?, ?>)obj;
  }

  private static String requireString(Map<?, ?> map, String key, String context) {
    String ret = optString(map, key);
    if (ret == null || ret.isEmpty())
      throw new ModelFormatException("Missing '" + key + "' in " + context);
    return ret;
  }

  private static String optString(Map<?, ?> map, String key) {
    Object val = map.get(key);
    return (val == null) ? null : val.toString();
  }

  private static int optInt(Map<?, ?> map, String key, int defaultValue) {
    Object val = map.get(key);
    if (val == null)
      return defaultValue;
    if (val instanceof Number)
      return ((Number)val).intValue();
    try {
      return Integer.parseInt(val.toString().trim());
    } catch (NumberFormatException e) {
      throw new ModelFormatException("'" + key + "' must be an integer, got " + val, e);
    }
  }
}
