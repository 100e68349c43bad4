package io.intellixity.typeset.types;

/**
 * A single member of a {@link TypeSet}: either a {@link BuiltinType} or a {@link NamedType}.
 */
public interface TypeTag {
  /** Canonical spelling, as accepted by {@link TypeSet#of(String)} and printed by {@link TypeSet#toString()}. */
  String id();

  /** True for categories that stand for several concrete tags at once (scalar, number, iterable, mixed). */
  default boolean pseudo() {
    return false;
  }
}
