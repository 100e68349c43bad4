package io.intellixity.typeset.types;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tiny type DSL parser.
 *
 * <pre>
 * spec := '?'? tag ('|' tag)*
 * tag  := keyword | name
 * name := ident ('.' ident)*
 * </pre>
 */
final class TypeSpecParser {
  private static final Pattern NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

  private TypeSpecParser() {}

  static List<TypeTag> parse(String spec) {
    if (spec == null || spec.isBlank()) throw new InvalidTypeNameException(spec, "type is blank");
    String s = spec.trim();

    List<TypeTag> out = new ArrayList<>();
    if (s.startsWith("?")) {
      out.add(BuiltinType.NULL);
      s = s.substring(1);
      if (s.isBlank()) throw new InvalidTypeNameException(spec, "nullable marker requires a type: " + spec);
    }

    // split with limit -1 so that "int|" and "|int" surface an empty member
    for (String part : s.split("\\|", -1)) {
      out.add(parseName(part));
    }
    return out;
  }

  static TypeTag parseName(String word) {
    if (word == null || word.isBlank()) throw new InvalidTypeNameException(word, "type is blank");
    String w = word.trim();

    BuiltinType builtin = BuiltinType.forKeyword(w);
    if (builtin != null) return builtin;

    if (!NAME.matcher(w).matches()) {
      throw new InvalidTypeNameException(word, "Invalid type name: '" + w + "'");
    }
    return new NamedType(w);
  }
}
