package io.intellixity.typeset.collections;

/** Raised when a transformation (flip, map, combine) would produce the same key twice. */
public final class DuplicateKeyException extends RuntimeException {
  public DuplicateKeyException(String message) {
    super(message);
  }
}
