package cal.prim.concurrency;

import cal.prim.PreconditionFailed;

import java.util.Objects;

/**
 * A {@link StringRegister} that lives in this JVM only.  Several writers in one process can
 * share an instance to simulate independent machines sharing a remote register.
 */
public class InMemoryStringRegister implements StringRegister {

  private final String name;
  private String value = "";

  public InMemoryStringRegister() {
    this("anonymous");
  }

  public InMemoryStringRegister(String name) {
    this.name = name;
  }

  @Override
  public synchronized String read() {
    return value;
  }

  @Override
  public synchronized void write(String expectedValue, String newValue) throws PreconditionFailed {
    Objects.requireNonNull(expectedValue, "expected value may not be null");
    Objects.requireNonNull(newValue, "new value may not be null");

    if (!value.equals(expectedValue)) {
      throw new PreconditionFailed("register " + name + ": expected '" + expectedValue + "' but value is currently '" + value + '\'');
    }
    value = newValue;
  }

  @Override
  public String toString() {
    return "memory:" + name;
  }

}
