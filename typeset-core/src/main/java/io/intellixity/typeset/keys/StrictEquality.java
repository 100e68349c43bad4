package io.intellixity.typeset.keys;

import io.intellixity.typeset.types.BuiltinType;
import io.intellixity.typeset.types.TypeTags;

import java.util.*;

/**
 * Strict (type and value) equality, consistent with {@link KeyCodec}.
 *
 * <p>Unlike comparing encodings, this never registers instances and accepts NaN, which is
 * unequal to everything including itself. It also accepts self-containing composites: a pair of
 * composites met again while already being compared counts as equal, so {@code a = [1, a]} and
 * {@code b = [1, b]} are equal.</p>
 */
public final class StrictEquality {
  private StrictEquality() {}

  public static boolean test(Object a, Object b) {
    return test(a, b, new IdentityHashMap<>());
  }

  // path: composites currently being compared, left side to the right sides it is paired with
  private static boolean test(Object a, Object b, Map<Object, Set<Object>> path) {
    BuiltinType ta = TypeTags.basicOf(a);
    if (ta != TypeTags.basicOf(b)) return false;
    if (a == b && ta != BuiltinType.FLOAT) return true;
    return switch (ta) {
      case NULL -> true;
      case BOOL -> a.equals(b);
      case INT -> KeyCodec.integral(a).equals(KeyCodec.integral(b));
      case FLOAT -> ((Number) a).doubleValue() == ((Number) b).doubleValue();
      case TEXT -> a.toString().equals(b.toString());
      case COMPOSITE -> composites(a, b, path);
      default -> false;
    };
  }

  private static boolean composites(Object a, Object b, Map<Object, Set<Object>> path) {
    if (Composites.isMap(a) != Composites.isMap(b)) return false;
    Set<Object> partners = path.computeIfAbsent(a, k -> Collections.newSetFromMap(new IdentityHashMap<>()));
    if (!partners.add(b)) return true;
    try {
      return Composites.isMap(a) ? maps((Map<?, ?>) a, (Map<?, ?>) b, path) : sequences(a, b, path);
    } finally {
      partners.remove(b);
      if (partners.isEmpty()) path.remove(a);
    }
  }

  private static boolean maps(Map<?, ?> ma, Map<?, ?> mb, Map<Object, Set<Object>> path) {
    if (ma.size() != mb.size()) return false;
    Iterator<? extends Map.Entry<?, ?>> ia = ma.entrySet().iterator();
    Iterator<? extends Map.Entry<?, ?>> ib = mb.entrySet().iterator();
    while (ia.hasNext()) {
      Map.Entry<?, ?> ea = ia.next();
      Map.Entry<?, ?> eb = ib.next();
      if (!test(ea.getKey(), eb.getKey(), path) || !test(ea.getValue(), eb.getValue(), path)) return false;
    }
    return true;
  }

  private static boolean sequences(Object a, Object b, Map<Object, Set<Object>> path) {
    List<?> la = Composites.elements(a);
    List<?> lb = Composites.elements(b);
    if (la.size() != lb.size()) return false;
    for (int i = 0; i < la.size(); i++) {
      if (!test(la.get(i), lb.get(i), path)) return false;
    }
    return true;
  }
}
