package blockgen.codegen;

import java.util.Optional;
import java.util.stream.Stream;

/** Fixed-step scheme advancing the continuous states, shared by the generated C and the simulator. */
public enum IntegrationMethod {
  /** x += dt * dx(t, x) */
  Euler("euler"),
  /** Classic fourth-order Runge-Kutta. */
  RK4("rk4");

  public final String serialName;

  private IntegrationMethod(String serialName) { this.serialName = serialName; }

  public static Optional<IntegrationMethod> fromSerialName(String serialName) {
    return Stream.of(IntegrationMethod.values()).filter(method -> method.serialName.equalsIgnoreCase(serialName.trim())).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
