package io.intellixity.typeset.keys;

import java.lang.reflect.Array;
import java.util.AbstractList;
import java.util.List;
import java.util.Map;

/** Uniform view over the composite kinds: lists and arrays are sequences, maps are maps. */
final class Composites {
  private Composites() {}

  static boolean isSequence(Object v) {
    return v instanceof List<?> || (v != null && v.getClass().isArray());
  }

  static boolean isMap(Object v) {
    return v instanceof Map<?, ?>;
  }

  /** Read-only list view of a list or an array (primitive arrays are boxed on read). */
  static List<?> elements(Object sequence) {
    if (sequence instanceof List<?> l) return l;
    return new AbstractList<Object>() {
      @Override public Object get(int index) { return Array.get(sequence, index); }
      @Override public int size() { return Array.getLength(sequence); }
    };
  }
}
