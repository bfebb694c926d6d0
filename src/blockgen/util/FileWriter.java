package blockgen.util;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/*
 * Class for writing the generated artifacts.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String base_path;
  /** file name -> content, in write order */
  private final Map<String, String> files = new LinkedHashMap<>();

  public FileWriter(String base_path) { this.base_path = base_path; }

  public void AddFile(String fileName, String content) { files.put(fileName, content); }

  /** Adds a YAML document rendered in block style. */
  public void AddYaml(String fileName, Map<String, Object> document) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    AddFile(fileName, new Yaml(options).dump(document));
  }

  /**
   * Writes all added files, creating the output directory if needed.
   * @return false if any file could not be written
   */
  public boolean WriteFiles() {
    File dir = new File(base_path);
    if (!dir.isDirectory() && !dir.mkdirs()) {
      logger.error("Cannot create output directory {}", dir.getAbsolutePath());
      return false;
    }
    boolean success = true;
    for (var entry : files.entrySet()) {
      File file = new File(dir, entry.getKey());
      try (PrintWriter out = new PrintWriter(file, StandardCharsets.UTF_8)) {
        out.print(entry.getValue());
        if (out.checkError())
          throw new IOException("write error");
        logger.info("Wrote {}", file.getPath());
      } catch (IOException e) {
        logger.error("Cannot write {}: {}", file.getPath(), e.getMessage());
        success = false;
      }
    }
    return success;
  }
}
