package io.intellixity.typeset.types;

/**
 * Raised by {@link TypeSet#check(Object, String)} when a value does not satisfy the set.
 * <p>
 * Carries the role label ("key", "value", ...), the expected set and the value's actual type.
 */
public final class TypeMismatchException extends RuntimeException {
  private final String label;
  private final TypeSet expected;
  private final BuiltinType actualTag;
  private final String actualType;

  public TypeMismatchException(String label, TypeSet expected, BuiltinType actualTag, String actualType) {
    super("Disallowed " + label + " type: expected " + expected + ", got " + actualType + ".");
    this.label = label;
    this.expected = expected;
    this.actualTag = actualTag;
    this.actualType = actualType;
  }

  public String label() { return label; }
  public TypeSet expected() { return expected; }
  public BuiltinType actualTag() { return actualTag; }
  public String actualType() { return actualType; }
}
