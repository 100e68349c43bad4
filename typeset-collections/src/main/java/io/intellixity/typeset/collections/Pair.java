package io.intellixity.typeset.collections;

/**
 * Immutable key/value pair. {@link Dictionary} stores one per entry, holding the key in its
 * original, un-encoded form.
 */
public record Pair<K, V>(K key, V value) {
  public static <K, V> Pair<K, V> of(K key, V value) {
    return new Pair<>(key, value);
  }
}
