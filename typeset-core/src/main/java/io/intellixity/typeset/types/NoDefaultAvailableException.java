package io.intellixity.typeset.types;

/** Raised by {@link TypeSet#defaultValue()} when no zero value can be derived for the set. */
public final class NoDefaultAvailableException extends RuntimeException {
  public NoDefaultAvailableException(TypeSet types) {
    super("No default value could be determined for this TypeSet: " + types);
  }

  public NoDefaultAvailableException(TypeSet types, Throwable cause) {
    super("No default value could be determined for this TypeSet: " + types, cause);
  }
}
