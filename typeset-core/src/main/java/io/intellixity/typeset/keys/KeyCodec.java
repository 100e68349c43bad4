package io.intellixity.typeset.keys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.typeset.types.BuiltinType;
import io.intellixity.typeset.types.TypeTags;

import java.math.BigInteger;
import java.util.*;

/**
 * Canonical string index for any value.
 *
 * <p>{@code encode(a).equals(encode(b))} iff {@code a} and {@code b} are strictly equal: same
 * concrete tag and same content, or the same instance for identity-bearing values. Every tag has its
 * own prefix, so {@code 1}, {@code "1"} and {@code true} never collide.</p>
 *
 * <pre>
 * null            n
 * true            b:1
 * 42, 42L         i:42
 * 1.5             f:1.5
 * "abc"           s:abc
 * [1, "a"]        a:["i:1","s:a"]
 * {k: v}          m:[["s:k","..."]]
 * object          o:&lt;token&gt;
 * handle          r:&lt;token&gt;
 * callable        c:&lt;token&gt;
 * </pre>
 *
 * Composite members are written as a JSON array of their own encodings, which keeps the
 * separator unambiguous whatever the members contain.
 *
 * <p>Map entries are encoded in iteration order, so two {@code equals} maps can encode
 * differently. Maps used as keys should have a defined order: a {@link LinkedHashMap} filled in
 * the same order, or a {@link SortedMap}. A {@link HashMap} gives no such guarantee.</p>
 */
public final class KeyCodec {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final IdentityRegistry registry;

  public KeyCodec(IdentityRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public IdentityRegistry registry() {
    return registry;
  }

  /**
   * @throws IllegalArgumentException for NaN, or for a composite that contains itself
   */
  public String encode(Object value) {
    return encode(value, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private String encode(Object v, Set<Object> path) {
    BuiltinType tag = TypeTags.basicOf(v);
    return switch (tag) {
      case NULL -> "n";
      case BOOL -> (Boolean) v ? "b:1" : "b:0";
      case INT -> "i:" + integral(v);
      case FLOAT -> "f:" + floating(((Number) v).doubleValue());
      case TEXT -> "s:" + v;
      case COMPOSITE -> composite(v, path);
      case HANDLE -> "r:" + registry.tokenFor(v);
      case CALLABLE -> "c:" + registry.tokenFor(v);
      default -> "o:" + registry.tokenFor(v);
    };
  }

  private String composite(Object v, Set<Object> path) {
    if (!path.add(v)) {
      throw new IllegalArgumentException("Cannot encode a composite that contains itself");
    }
    try {
      if (Composites.isMap(v)) {
        List<List<String>> entries = new ArrayList<>();
        for (var e : ((Map<?, ?>) v).entrySet()) {
          entries.add(List.of(encode(e.getKey(), path), encode(e.getValue(), path)));
        }
        return "m:" + json(entries);
      }
      List<String> parts = new ArrayList<>();
      for (Object el : Composites.elements(v)) parts.add(encode(el, path));
      return "a:" + json(parts);
    } finally {
      path.remove(v);
    }
  }

  static String integral(Object v) {
    if (v instanceof BigInteger bi) return bi.toString();
    return Long.toString(((Number) v).longValue());
  }

  static String floating(double d) {
    if (Double.isNaN(d)) throw new IllegalArgumentException("NaN cannot be used as a key");
    // -0.0 and 0.0 are the same key
    if (d == 0.0) d = 0.0;
    return Double.toString(d);
  }

  private static String json(Object parts) {
    try {
      return JSON.writeValueAsString(parts);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to JSON-encode composite key", e);
    }
  }
}
