package io.intellixity.typeset.types;

import io.intellixity.typeset.util.TypesetFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability sets for named-type matching.
 *
 * A class answers to:
 * - its own binary, canonical and simple names
 * - the same names of every superclass and every implemented interface
 * - traits declared for itself or any of those supertypes
 *
 * Capability sets are computed once per class and cached; declaring a trait drops the cache,
 * and a set computed while a declaration was in progress is never cached.
 */
public final class TypeCapabilities {
  private static final Logger log = LoggerFactory.getLogger(TypeCapabilities.class);

  private final Map<Class<?>, Set<String>> declared = new HashMap<>();
  private final Map<Class<?>, Set<String>> cache = new ConcurrentHashMap<>();
  // bumped by every declare; guarded by declared
  private long generation;
  private final ClassLoader classLoader;

  public TypeCapabilities() {
    this(List.of());
  }

  public TypeCapabilities(List<CapabilityProvider> providers) {
    this(providers, TypeCapabilities.class.getClassLoader());
  }

  TypeCapabilities(List<CapabilityProvider> providers, ClassLoader classLoader) {
    this.classLoader = classLoader;
    for (CapabilityProvider p : providers) {
      if (p == null) continue;
      Map<Class<?>, Collection<String>> traits = p.traits();
      if (traits == null) continue;
      for (var e : traits.entrySet()) {
        declare(e.getKey(), e.getValue().toArray(new String[0]));
      }
    }
  }

  /** Process-wide capabilities, discovered on first use. */
  public static TypeCapabilities shared() {
    return Shared.INSTANCE;
  }

  private static final class Shared {
    static final TypeCapabilities INSTANCE = discovered();
  }

  /** Capabilities with every {@link CapabilityProvider} found under {@code META-INF/typeset.factories}. */
  public static TypeCapabilities discovered() {
    List<CapabilityProvider> providers = TypesetFactoriesLoader.load(CapabilityProvider.class);
    if (log.isDebugEnabled()) {
      log.debug("typeset.capabilities discovered providers={} classes={}",
          providers.size(), providers.stream().map(p -> p.getClass().getName()).toList());
    }
    return new TypeCapabilities(providers);
  }

  /**
   * Declares traits carried by {@code type} (and inherited by its subtypes).
   *
   * @throws InvalidTypeNameException if a trait is not a legal name or collides with a built-in keyword
   */
  public TypeCapabilities declare(Class<?> type, String... traits) {
    Objects.requireNonNull(type, "type");
    List<String> names = new ArrayList<>(traits.length);
    for (String t : traits) {
      TypeTag tag = TypeSpecParser.parseName(t);
      if (!(tag instanceof NamedType n)) {
        throw new InvalidTypeNameException(t, "Trait name collides with built-in type: " + t);
      }
      names.add(n.name());
    }
    synchronized (declared) {
      declared.computeIfAbsent(type, k -> new LinkedHashSet<>()).addAll(names);
      generation++;
      cache.clear();
    }
    return this;
  }

  /** True iff {@code value} is non-null and its class answers to {@code name}. */
  public boolean satisfies(Object value, String name) {
    if (value == null) return false;
    return capabilitiesOf(value.getClass()).contains(name);
  }

  /** All names the given class answers to. */
  public Set<String> capabilitiesOf(Class<?> type) {
    Objects.requireNonNull(type, "type");
    Set<String> caps = cache.get(type);
    if (caps != null) return caps;
    long seen;
    synchronized (declared) {
      seen = generation;
    }
    caps = compute(type);
    synchronized (declared) {
      // a declare ran while computing: the set may lack its traits, so leave it out of the cache
      if (generation == seen) cache.put(type, caps);
    }
    return caps;
  }

  /**
   * Instantiates {@code name} through its public no-arg constructor, if {@code name} is a
   * loadable concrete class that has one.
   */
  Optional<Object> instantiate(String name) {
    Class<?> c;
    try {
      c = Class.forName(name, false, classLoader);
    } catch (ClassNotFoundException | LinkageError e) {
      return Optional.empty();
    }
    if (c.isInterface() || Modifier.isAbstract(c.getModifiers()) || !Modifier.isPublic(c.getModifiers())) {
      return Optional.empty();
    }
    Constructor<?> ctor;
    try {
      ctor = c.getConstructor();
    } catch (NoSuchMethodException e) {
      return Optional.empty();
    }
    try {
      return Optional.of(ctor.newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate default " + name, e);
    }
  }

  private Set<String> compute(Class<?> type) {
    Set<String> out = new LinkedHashSet<>();
    Deque<Class<?>> todo = new ArrayDeque<>();
    Set<Class<?>> seen = new HashSet<>();
    todo.add(type);
    while (!todo.isEmpty()) {
      Class<?> c = todo.poll();
      if (!seen.add(c)) continue;
      addNames(out, c);
      synchronized (declared) {
        Set<String> traits = declared.get(c);
        if (traits != null) out.addAll(traits);
      }
      if (c.getSuperclass() != null) todo.add(c.getSuperclass());
      todo.addAll(Arrays.asList(c.getInterfaces()));
    }
    return Collections.unmodifiableSet(out);
  }

  private static void addNames(Set<String> out, Class<?> c) {
    out.add(c.getName());
    if (c.getCanonicalName() != null) out.add(c.getCanonicalName());
    if (!c.getSimpleName().isEmpty()) out.add(c.getSimpleName());
  }
}
