package cal.biglist.impls;

import cal.prim.storage.Directory;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * An in-memory location whose directory refuses to create entries matching a predicate.
 */
class FlakyLocation extends InMemoryLocation {

  private final Directory flaky;

  FlakyLocation(String name, Predicate<String> shouldFail) {
    super(name);
    Directory real = super.directory();
    flaky = new Directory() {
      @Override
      public Stream<String> list(String prefix) throws IOException {
        return real.list(prefix);
      }

      @Override
      public boolean exists(String name) throws IOException {
        return real.exists(name);
      }

      @Override
      public void createOrReplace(String name, InputStream stream) throws IOException {
        check(name);
        real.createOrReplace(name, stream);
      }

      @Override
      public void create(String name, InputStream stream) throws IOException {
        check(name);
        real.create(name, stream);
      }

      @Override
      public InputStream open(String name) throws IOException {
        return real.open(name);
      }

      @Override
      public void delete(String name) throws IOException {
        real.delete(name);
      }

      private void check(String name) throws IOException {
        if (shouldFail.test(name)) {
          throw new IOException("injected failure writing " + name);
        }
      }
    };
  }

  @Override
  public Directory directory() {
    return flaky;
  }

}
