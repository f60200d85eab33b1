package cal.biglist.impls;

import cal.prim.concurrency.InMemoryStringRegister;
import cal.prim.concurrency.StringRegister;
import cal.prim.storage.Directory;
import cal.prim.storage.InMemoryDirectory;

/**
 * A location in the heap.  Writers that share one instance behave like independent
 * machines sharing a bucket, which makes this the location of choice for tests.
 */
public class InMemoryLocation extends AbstractLocation {

  private final String name;
  private final InMemoryDirectory directory = new InMemoryDirectory();

  public InMemoryLocation(String name) {
    this.name = name;
  }

  public InMemoryLocation() {
    this("anonymous");
  }

  @Override
  public Directory directory() {
    return directory;
  }

  @Override
  protected StringRegister newRegister(String registerName) {
    return new InMemoryStringRegister(name + '#' + registerName);
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return "memory://" + name;
  }

}
