package cal.biglist.impls;

import cal.biglist.types.Location;
import cal.prim.PreconditionFailed;
import cal.prim.concurrency.StringRegister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Caches registers by name and implements {@link #destroy()} in terms of the directory.
 */
public abstract class AbstractLocation implements Location {

  private static final Logger log = LoggerFactory.getLogger(AbstractLocation.class);

  private static final Pattern LEGAL_REGISTER_NAME = Pattern.compile("[A-Za-z0-9-]+");

  private final Map<String, StringRegister> registers = new LinkedHashMap<>();

  protected abstract StringRegister newRegister(String name) throws IOException;

  @Override
  public synchronized StringRegister register(String name) throws IOException {
    if (!LEGAL_REGISTER_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("illegal register name '" + name + '\'');
    }
    StringRegister result = registers.get(name);
    if (result == null) {
      result = newRegister(name);
      registers.put(name, result);
    }
    return result;
  }

  protected synchronized List<StringRegister> openRegisters() {
    return new ArrayList<>(registers.values());
  }

  protected synchronized void forgetRegisters() {
    registers.clear();
  }

  /**
   * Set a register back to the empty string, whatever it holds now.
   */
  protected static void reset(StringRegister register) throws IOException {
    for (;;) {
      String current = register.read();
      if (current.isEmpty()) {
        return;
      }
      try {
        register.write(current, "");
        return;
      } catch (PreconditionFailed e) {
        log.debug("Register {} changed during reset; retrying", register);
      }
    }
  }

  @Override
  public void destroy() throws IOException {
    for (StringRegister register : openRegisters()) {
      reset(register);
    }
    List<String> names;
    try (Stream<String> entries = directory().list("")) {
      names = entries.collect(Collectors.toList());
    }
    for (String name : names) {
      directory().delete(name);
    }
    log.debug("Destroyed {} ({} files)", this, names.size());
  }

}
