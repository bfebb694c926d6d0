package blockgen.blocks;

import blockgen.flatten.FlattenedBlock;
import java.util.List;

/**
 * Signed sum of all inputs. The "signs" parameter holds one '+' or '-' per input port.
 */
public class SumModule extends ElementWiseModule {

  @Override
  public int inputCount(FlattenedBlock block, int connectedPorts) {
    String signs = signs(block.block().getString("signs", ""));
    return signs.isEmpty() ? Math.max(connectedPorts, 2) : Math.max(connectedPorts, signs.length());
  }

  private static String signs(String raw) { return raw.replaceAll("[^+-]", ""); }

  private static boolean isNegative(PlannedBlock block, int port) {
    String signs = signs(block.params().getString("signs", ""));
    return port < signs.length() && signs.charAt(port) == '-';
  }

  @Override
  protected String combineC(PlannedBlock block, List<String> elements) {
    StringBuilder ret = new StringBuilder();
    for (int port = 0; port < elements.size(); ++port) {
      boolean negative = isNegative(block, port);
      if (port == 0)
        ret.append(negative ? "-" : "");
      else
        ret.append(negative ? " - " : " + ");
      ret.append(elements.get(port));
    }
    return ret.toString();
  }

  @Override
  protected double combine(PlannedBlock block, double[] elements) {
    double ret = 0.0;
    for (int port = 0; port < elements.length; ++port) {
      if (port == 0)
        ret = isNegative(block, port) ? -elements[port] : elements[port];
      else if (isNegative(block, port))
        ret -= elements[port];
      else
        ret += elements[port];
    }
    return ret;
  }
}
