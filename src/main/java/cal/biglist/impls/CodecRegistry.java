package cal.biglist.impls;

import cal.biglist.types.Codec;
import cal.prim.transforms.XZCompression;
import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * An immutable table of {@link Codec}s by storage-format name.
 *
 * <p>Names are made of letters, digits, <code>-</code> and <code>_</code>; underscores are
 * normalized to dashes, so <code>"java_xz"</code> and <code>"java-xz"</code> are the same
 * format.  Data file extensions use the underscore spelling.
 *
 * <p>A registry is serializable when all of its codecs are; the bundled ones are.
 */
public final class CodecRegistry implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Pattern LEGAL_NAME = Pattern.compile("[A-Za-z0-9_-]+");

  private static final CodecRegistry DEFAULTS = builder()
          .register("json", new JsonCodec<>(Object.class))
          .register("json-xz", new TransformedCodec<>(new JsonCodec<>(Object.class), new XZCompression()))
          .register("java", new JavaSerializationCodec<>())
          .register("java-xz", new TransformedCodec<>(new JavaSerializationCodec<>(), new XZCompression()))
          .build();

  private final ImmutableMap<String, Codec<?>> codecs;

  private CodecRegistry(ImmutableMap<String, Codec<?>> codecs) {
    this.codecs = codecs;
  }

  /**
   * The bundled codecs: <code>json</code> and <code>json-xz</code> (Jackson),
   * <code>java</code> and <code>java-xz</code> (Java serialization).
   */
  public static CodecRegistry defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param name a format name
   * @return the canonical spelling of the name
   * @throws IllegalArgumentException if the name has illegal characters
   */
  public static String normalize(String name) {
    if (!LEGAL_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("illegal storage format name '" + name + "'; use letters, digits, '-' and '_'");
    }
    return name.replace('_', '-');
  }

  public boolean contains(String name) {
    return codecs.containsKey(normalize(name));
  }

  /**
   * @param name a format name
   * @return the codec for that format
   * @throws IllegalArgumentException if no such format is registered
   */
  @SuppressWarnings("unchecked")
  public <T> Codec<T> get(String name) {
    Codec<?> codec = codecs.get(normalize(name));
    if (codec == null) {
      throw new IllegalArgumentException("unknown storage format '" + name + "'; known formats are " + codecs.keySet());
    }
    return (Codec<T>)codec;
  }

  public Set<String> names() {
    return codecs.keySet();
  }

  /**
   * @return a builder that starts with this registry's codecs
   */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.codecs.putAll(codecs);
    return b;
  }

  @Override
  public String toString() {
    return "CodecRegistry" + codecs.keySet();
  }

  public static final class Builder {
    private final Map<String, Codec<?>> codecs = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * @throws IllegalArgumentException if the name is illegal or already taken
     */
    public Builder register(String name, Codec<?> codec) {
      String key = normalize(name);
      if (codecs.putIfAbsent(key, codec) != null) {
        throw new IllegalArgumentException("storage format '" + key + "' is already registered");
      }
      return this;
    }

    public CodecRegistry build() {
      return new CodecRegistry(ImmutableMap.copyOf(codecs));
    }
  }

}
