package io.intellixity.typeset.types;

import java.util.Objects;

/**
 * A class, interface or declared trait, referenced by name.
 *
 * <p>The name is only checked lexically here; it is resolved against a value's capabilities
 * at match time by {@link TypeCapabilities}.</p>
 */
public record NamedType(String name) implements TypeTag {
  public NamedType {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String id() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
