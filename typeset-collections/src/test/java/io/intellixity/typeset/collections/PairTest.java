package io.intellixity.typeset.collections;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PairTest {

  @Test
  void holdsAnyKeyAndValue() {
    Object key = new Object();
    Pair<Object, List<Integer>> p = Pair.of(key, List.of(1, 2));
    assertSame(key, p.key());
    assertEquals(List.of(1, 2), p.value());
  }

  @Test
  void allowsNulls() {
    Pair<String, String> p = new Pair<>(null, null);
    assertNull(p.key());
    assertNull(p.value());
  }

  @Test
  void equality_isByComponents() {
    assertEquals(Pair.of("a", 1), Pair.of("a", 1));
    assertNotEquals(Pair.of("a", 1), Pair.of("a", 2));
  }
}
