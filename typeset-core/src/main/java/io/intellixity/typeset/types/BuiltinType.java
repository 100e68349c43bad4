package io.intellixity.typeset.types;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed vocabulary of built-in type tags.
 *
 * <p>The first nine constants are concrete: every runtime value has exactly one of them
 * (see {@link TypeTags#basicOf(Object)}). The last four are pseudo-tags that expand at match time.</p>
 */
public enum BuiltinType implements TypeTag {
  NULL("null"),
  BOOL("bool", "boolean"),
  INT("int", "integer", "long"),
  FLOAT("float", "double"),
  TEXT("string", "text"),
  COMPOSITE("array", "composite"),
  OBJECT("object"),
  HANDLE("handle", "resource"),
  CALLABLE("callable"),

  SCALAR("scalar"),
  NUMBER("number"),
  ITERABLE("iterable"),
  MIXED("mixed", "any");

  private static final Map<String, BuiltinType> BY_KEYWORD = new HashMap<>();

  static {
    for (BuiltinType t : values()) {
      BY_KEYWORD.put(t.id, t);
      for (String alias : t.aliases) BY_KEYWORD.put(alias, t);
    }
  }

  private final String id;
  private final List<String> aliases;

  BuiltinType(String id, String... aliases) {
    this.id = id;
    this.aliases = List.of(aliases);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public boolean pseudo() {
    return this == SCALAR || this == NUMBER || this == ITERABLE || this == MIXED;
  }

  /** Looks up a keyword or alias, ignoring case. Returns null when the word is not a built-in. */
  public static BuiltinType forKeyword(String word) {
    if (word == null) return null;
    return BY_KEYWORD.get(word.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return id;
  }
}
