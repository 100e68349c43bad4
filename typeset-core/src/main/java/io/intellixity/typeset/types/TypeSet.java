package io.intellixity.typeset.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A runtime type constraint: a set of {@link TypeTag}s with union and nullable semantics.
 *
 * <p>An empty set places no constraint on values, null included. A set containing
 * {@link BuiltinType#MIXED} is equivalent, but keeps {@code mixed} as a member.</p>
 *
 * <p>Sets only grow: {@link #add(String)}, {@link #add(TypeSet)} and {@link #infer(Object)} add
 * members, nothing removes them.</p>
 *
 * <pre>
 * TypeSet.of("int|string")     // {int, string}
 * TypeSet.of("?int")           // {null, int}
 * TypeSet.of("scalar", "Comparable")
 * </pre>
 */
public final class TypeSet implements Iterable<TypeTag> {
  private static final Logger log = LoggerFactory.getLogger(TypeSet.class);

  private final Set<TypeTag> tags = new LinkedHashSet<>();
  private final TypeCapabilities capabilities;

  /** Empty set (no constraint) using the process-wide capabilities. */
  public TypeSet() {
    this(TypeCapabilities.shared());
  }

  public TypeSet(TypeCapabilities capabilities) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  /**
   * Parses a single name, a union ({@code "int|string"}) or a nullable name ({@code "?int"}).
   *
   * @throws InvalidTypeNameException if any member is blank or not a legal type word
   */
  public static TypeSet of(String spec) {
    return new TypeSet().add(spec);
  }

  /** Union of several specifications, each parsed as by {@link #of(String)}. */
  public static TypeSet of(String... specs) {
    TypeSet ts = new TypeSet();
    for (String s : specs) ts.add(s);
    return ts;
  }

  public static TypeSet of(Iterable<String> specs) {
    TypeSet ts = new TypeSet();
    for (String s : specs) ts.add(s);
    return ts;
  }

  public static TypeSet copyOf(TypeSet other) {
    return new TypeSet(other.capabilities).add(other);
  }

  public TypeCapabilities capabilities() {
    return capabilities;
  }

  // ---- growing ----

  public TypeSet add(String spec) {
    tags.addAll(TypeSpecParser.parse(spec));
    return this;
  }

  public TypeSet add(TypeTag... more) {
    for (TypeTag t : more) tags.add(Objects.requireNonNull(t, "tag"));
    return this;
  }

  public TypeSet add(TypeSet other) {
    tags.addAll(other.tags);
    return this;
  }

  /**
   * Adds the concrete tag of {@code value}, or its class name if it is a plain object.
   * Used to derive constraints from observed data instead of rejecting it.
   */
  public TypeSet infer(Object value) {
    BuiltinType basic = TypeTags.basicOf(value);
    TypeTag tag = basic == BuiltinType.OBJECT ? new NamedType(value.getClass().getName()) : basic;
    if (tags.add(tag) && log.isTraceEnabled()) {
      log.trace("typeset.infer added={} types={}", tag, this);
    }
    return this;
  }

  // ---- matching ----

  public boolean match(Object value) {
    if (anyOk()) return true;
    BuiltinType basic = TypeTags.basicOf(value);
    for (TypeTag t : tags) {
      if (matches(t, value, basic)) return true;
    }
    return false;
  }

  /**
   * @param label role of the value in the caller's terms, e.g. "key" or "value"
   * @throws TypeMismatchException if {@link #match(Object)} is false
   */
  public void check(Object value, String label) {
    if (match(value)) return;
    throw new TypeMismatchException(label, copyOf(this), TypeTags.basicOf(value), TypeTags.describe(value));
  }

  private boolean matches(TypeTag t, Object v, BuiltinType basic) {
    if (t instanceof NamedType n) return capabilities.satisfies(v, n.name());
    if (!(t instanceof BuiltinType b)) return false;
    return switch (b) {
      case NULL, BOOL, INT, FLOAT, TEXT, COMPOSITE, HANDLE, CALLABLE -> basic == b;
      case OBJECT -> basic == BuiltinType.OBJECT || basic == BuiltinType.HANDLE || basic == BuiltinType.CALLABLE;
      case SCALAR -> basic == BuiltinType.BOOL || basic == BuiltinType.INT
          || basic == BuiltinType.FLOAT || basic == BuiltinType.TEXT;
      case NUMBER -> basic == BuiltinType.INT || basic == BuiltinType.FLOAT;
      case ITERABLE -> basic == BuiltinType.COMPOSITE || v instanceof Iterable<?>;
      case MIXED -> true;
    };
  }

  // ---- inspection ----

  public boolean contains(TypeTag tag) {
    return tags.contains(tag);
  }

  /** Membership by name; aliases are normalized, so {@code contains("integer")} equals {@code contains("int")}. */
  public boolean contains(String name) {
    return tags.contains(TypeSpecParser.parseName(name));
  }

  public boolean containsAll(String... names) {
    for (String n : names) {
      if (!contains(n)) return false;
    }
    return true;
  }

  public boolean containsAll(TypeTag... more) {
    return tags.containsAll(Arrays.asList(more));
  }

  public boolean containsAny(String... names) {
    for (String n : names) {
      if (contains(n)) return true;
    }
    return false;
  }

  public boolean containsAny(TypeTag... more) {
    for (TypeTag t : more) {
      if (tags.contains(t)) return true;
    }
    return false;
  }

  /** Same members as the given names, in any order. */
  public boolean containsOnly(String... names) {
    Set<TypeTag> other = new HashSet<>();
    for (String n : names) other.add(TypeSpecParser.parseName(n));
    return tags.equals(other);
  }

  public boolean containsOnly(TypeTag... more) {
    return tags.equals(new HashSet<>(Arrays.asList(more)));
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  /** True if every value, null included, is accepted. */
  public boolean anyOk() {
    return tags.isEmpty() || tags.contains(BuiltinType.MIXED);
  }

  public boolean nullOk() {
    return anyOk() || tags.contains(BuiltinType.NULL);
  }

  public int size() {
    return tags.size();
  }

  @Override
  public Iterator<TypeTag> iterator() {
    return Collections.unmodifiableSet(tags).iterator();
  }

  // ---- defaults ----

  /**
   * Zero value for this set, by fixed priority: null, false, 0, 0.0, "", empty list,
   * a plain {@code Object}, then the first named class with a public no-arg constructor.
   *
   * @throws NoDefaultAvailableException if none applies (handles, callables, most named types)
   */
  public Object defaultValue() {
    if (nullOk()) return null;
    if (tags.contains(BuiltinType.BOOL)) return false;
    if (containsAny(BuiltinType.INT, BuiltinType.NUMBER, BuiltinType.SCALAR)) return 0;
    if (tags.contains(BuiltinType.FLOAT)) return 0.0;
    if (tags.contains(BuiltinType.TEXT)) return "";
    if (containsAny(BuiltinType.COMPOSITE, BuiltinType.ITERABLE)) return new ArrayList<>();
    if (tags.contains(BuiltinType.OBJECT)) return new Object();
    for (TypeTag t : tags) {
      if (!(t instanceof NamedType n)) continue;
      Optional<Object> made;
      try {
        made = capabilities.instantiate(n.name());
      } catch (IllegalStateException e) {
        throw new NoDefaultAvailableException(this, e);
      }
      if (made.isPresent()) return made.get();
    }
    throw new NoDefaultAvailableException(this);
  }

  // ---- object ----

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TypeSet other)) return false;
    return tags.equals(other.tags);
  }

  @Override
  public int hashCode() {
    return tags.hashCode();
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "{", "}");
    for (TypeTag t : tags) sj.add(t.id());
    return sj.toString();
  }
}
