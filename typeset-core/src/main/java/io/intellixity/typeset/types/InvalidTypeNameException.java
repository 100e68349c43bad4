package io.intellixity.typeset.types;

/** Raised when a type specification is blank or names something that is not a legal type word. */
public final class InvalidTypeNameException extends IllegalArgumentException {
  private final String typeName;

  public InvalidTypeNameException(String typeName, String message) {
    super(message);
    this.typeName = typeName;
  }

  /** The offending name as written, possibly null or blank. */
  public String typeName() {
    return typeName;
  }
}
