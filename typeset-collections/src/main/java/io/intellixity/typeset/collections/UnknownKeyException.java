package io.intellixity.typeset.collections;

import java.util.NoSuchElementException;

/** Raised when a lookup or removal targets a key the dictionary does not hold. */
public final class UnknownKeyException extends NoSuchElementException {
  private final transient Object key;

  public UnknownKeyException(Object key, String message) {
    super(message);
    this.key = key;
  }

  public Object key() {
    return key;
  }
}
