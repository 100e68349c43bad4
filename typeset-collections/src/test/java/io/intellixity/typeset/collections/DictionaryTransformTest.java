package io.intellixity.typeset.collections;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DictionaryTransformTest {
  private final CollectionContext ctx = CollectionContext.isolated();

  private Dictionary<String, Integer> abc() {
    Dictionary<String, Integer> d = new Dictionary<>(ctx, "string", "int");
    return d.add("a", 1).add("b", 2).add("c", 3);
  }

  // ---- flip ----

  @Test
  void flip_swapsKeysValuesAndConstraints() {
    Dictionary<String, Integer> d = abc();
    Dictionary<Integer, String> flipped = d.flip();
    assertTrue(flipped.keyTypes().containsOnly("int"));
    assertTrue(flipped.valueTypes().containsOnly("string"));
    assertEquals("a", flipped.get(1));
    assertEquals("c", flipped.get(3));
    assertEquals(1, d.get("a"));
  }

  @Test
  void flip_emptyDictionary() {
    assertTrue(new Dictionary<String, Integer>(ctx, "string", "int").flip().isEmpty());
  }

  @Test
  void flip_duplicateValuesFail() {
    Dictionary<String, Integer> d = abc().add("d", 1);
    DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, d::flip);
    assertEquals("Cannot flip Dictionary: values are not unique.", ex.getMessage());
  }

  @Test
  void flip_compositeValuesBecomeContentKeys() {
    Dictionary<String, List<Integer>> d = new Dictionary<>(ctx);
    d.put("evens", List.of(2, 4));
    Dictionary<List<Integer>, String> flipped = d.flip();
    assertEquals("evens", flipped.get(List.of(2, 4)));
  }

  // ---- merge ----

  @Test
  void merge_appendsOtherAndKeepsOriginals() {
    Dictionary<String, Integer> other = new Dictionary<>(ctx, "string", "int");
    other.add("d", 4);
    Dictionary<String, Integer> merged = abc().merge(other);
    assertEquals(List.of("a", "b", "c", "d"), merged.keys());
    assertEquals(1, other.size());
  }

  @Test
  void merge_overlappingKeyTakesOtherValueInFirstPosition() {
    Dictionary<String, Integer> other = new Dictionary<>(ctx, "string", "int");
    other.add("b", 20).add("z", 26);
    Dictionary<String, Integer> merged = abc().merge(other);
    assertEquals(List.of("a", "b", "c", "z"), merged.keys());
    assertEquals(20, merged.get("b"));
  }

  @Test
  void merge_unionsConstraints() {
    Dictionary<String, Number> ints = new Dictionary<>(ctx, "string", "int");
    ints.put("a", 1);
    Dictionary<String, Double> floats = new Dictionary<>(ctx, "string", "float");
    floats.put("b", 2.5);
    Dictionary<String, Number> merged = ints.merge(floats);
    assertEquals(2, merged.valueTypes().size());
    assertTrue(merged.valueTypes().containsAll("int", "float"));
    assertEquals(2.5, merged.get("b"));
    assertTrue(ints.valueTypes().containsOnly("int"));
  }

  @Test
  void merge_withEmpty() {
    Dictionary<String, Integer> merged = abc().merge(new Dictionary<>(ctx, "string", "int"));
    assertTrue(merged.contentEquals(abc()));
  }

  // ---- filter ----

  @Test
  void filter_keepsMatchingEntriesInOrder() {
    Dictionary<String, Integer> d = abc().add("d", 4);
    Dictionary<String, Integer> even = d.filter((k, v) -> v % 2 == 0);
    assertEquals(List.of("b", "d"), even.keys());
    assertEquals(4, d.size());
  }

  @Test
  void filter_canUseKeys() {
    Dictionary<String, Integer> d = new Dictionary<>(ctx, "string", "int");
    d.add("apple", 5).add("banana", 3).add("avocado", 7);
    assertEquals(List.of("apple", "avocado"), d.filter((k, v) -> k.startsWith("a")).keys());
  }

  @Test
  void filter_preservesConstraints() {
    Dictionary<String, Integer> filtered = abc().filter((k, v) -> v > 1);
    filtered.add("d", 4);
    assertEquals(3, filtered.size());
    assertTrue(filtered.keyTypes().containsOnly("string"));
    assertTrue(filtered.filter((k, v) -> false).isEmpty());
  }

  // ---- map ----

  @Test
  void map_transformsValues() {
    Dictionary<String, Integer> doubled = abc().map(p -> Pair.of(p.key(), p.value() * 2));
    assertEquals(List.of(2, 4, 6), doubled.values());
    assertEquals(List.of("a", "b", "c"), doubled.keys());
  }

  @Test
  void map_transformsKeys() {
    Dictionary<Integer, String> d = new Dictionary<>(ctx, "int", "string");
    d.add(1, "a").add(2, "b");
    Dictionary<String, String> mapped = d.map(p -> Pair.of("key" + p.key(), p.value()));
    assertEquals("b", mapped.get("key2"));
  }

  @Test
  void map_infersResultTypes() {
    Dictionary<String, Double> mapped = abc().map(p -> Pair.of(p.key(), p.value() * 1.5));
    assertTrue(mapped.keyTypes().containsOnly("string"));
    assertTrue(mapped.valueTypes().containsOnly("float"));
  }

  @Test
  void map_emptyDictionary() {
    Dictionary<String, Integer> empty = new Dictionary<>(ctx, "string", "int");
    Dictionary<String, Integer> mapped = empty.map(p -> Pair.of(p.key(), p.value()));
    assertTrue(mapped.isEmpty());
    assertTrue(mapped.keyTypes().isEmpty());
  }

  @Test
  void map_nullResultFails() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> abc().map(p -> null));
    assertEquals("Map callback must return a Pair, got null.", ex.getMessage());
  }

  @Test
  void map_duplicateKeyFails() {
    DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
        () -> abc().map(p -> Pair.of("same", p.value())));
    assertTrue(ex.getMessage().startsWith("Map callback produced a duplicate key"));
  }

  // ---- combine ----

  @Test
  void combine_zipsAndInfers() {
    Dictionary<String, Integer> d = Dictionary.combine(ctx, List.of("a", "b"), List.of(1, 2), true);
    assertEquals(List.of("a", "b"), d.keys());
    assertTrue(d.keyTypes().containsOnly("string"));
    assertTrue(d.valueTypes().containsOnly("int"));
  }

  @Test
  void combine_withoutInferenceIsUnconstrained() {
    Dictionary<Object, Object> d = Dictionary.combine(ctx, List.of("a"), List.of(1), false);
    assertTrue(d.keyTypes().isEmpty());
    d.put(2.5, "anything");
    assertEquals(2, d.size());
  }

  @Test
  void combine_countMismatchFails() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dictionary.combine(ctx, List.of("a", "b"), List.of(1), true));
    assertEquals("Cannot combine: keys count (2) does not match values count (1).", ex.getMessage());
  }

  @Test
  void combine_duplicateKeysFail() {
    DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
        () -> Dictionary.combine(ctx, List.of("a", "a"), List.of(1, 2), true));
    assertEquals("Cannot combine: keys are not unique.", ex.getMessage());
  }

  // ---- conversion ----

  @Test
  void toSequence_yieldsPairsInOrder() {
    Sequence<Pair<String, Integer>> s = abc().toSequence();
    assertEquals(3, s.size());
    assertEquals(Pair.of("b", 2), s.get(1));
    assertTrue(s.valueTypes().containsOnly(Pair.class.getName()));
  }
}
