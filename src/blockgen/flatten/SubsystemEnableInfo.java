package blockgen.flatten;

import blockgen.frontend.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Enable metadata of one subsystem instance.
 *
 * @param subsystemId instance id of the subsystem
 * @param subsystemName flattened name of the subsystem
 * @param enableWire wire into the enable port, already rewired to its true source; null if none
 * @param parentSubsystemId nearest enclosing subsystem with its own enable input, or null
 * @param controlledBlockIds flattened blocks nested anywhere inside this subsystem
 * @param depth number of enclosing subsystems including this one
 */
public record SubsystemEnableInfo(String subsystemId, String subsystemName, boolean hasEnableInput, Connection enableWire,
                                  String parentSubsystemId, List<String> controlledBlockIds, int depth) {

  public SubsystemEnableInfo {
    controlledBlockIds = List.copyOf(controlledBlockIds);
  }

  public Optional<Connection> GetEnableWire() { return Optional.ofNullable(enableWire); }

  /** No own enable input, but an enabled ancestor whose flag is inherited. */
  public boolean inheritsEnable() { return !hasEnableInput && parentSubsystemId != null; }

  /** Whether this subsystem needs an enable flag at all. */
  public boolean isNonTrivial() { return hasEnableInput || parentSubsystemId != null; }
}
