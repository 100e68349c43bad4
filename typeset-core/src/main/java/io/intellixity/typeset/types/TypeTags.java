package io.intellixity.typeset.types;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/** Classifies runtime values into their concrete {@link BuiltinType}. */
public final class TypeTags {
  private static final ClassValue<Boolean> CALLABLE = new ClassValue<>() {
    @Override
    protected Boolean computeValue(Class<?> c) {
      return implementsFunctionalInterface(c);
    }
  };

  private TypeTags() {}

  /**
   * Returns the concrete tag of a value. Never returns a pseudo-tag.
   *
   * <p>Lists, maps and arrays are composites. {@link AutoCloseable} instances are handles.
   * Lambdas, method references and implementations of {@link Runnable}, {@link Callable} or a
   * {@code java.util.function} interface are callables. Any other non-null reference is an object.</p>
   */
  public static BuiltinType basicOf(Object v) {
    if (v == null) return BuiltinType.NULL;
    if (v instanceof Boolean) return BuiltinType.BOOL;
    if (isIntegral(v)) return BuiltinType.INT;
    if (v instanceof Double || v instanceof Float) return BuiltinType.FLOAT;
    if (v instanceof String || v instanceof Character) return BuiltinType.TEXT;
    if (v instanceof List<?> || v instanceof Map<?, ?> || v.getClass().isArray()) return BuiltinType.COMPOSITE;
    if (v instanceof AutoCloseable) return BuiltinType.HANDLE;
    if (isFunctional(v.getClass())) return BuiltinType.CALLABLE;
    return BuiltinType.OBJECT;
  }

  /** Integral boxes share one tag: 1, 1L and BigInteger.ONE are the same int. */
  public static boolean isIntegral(Object v) {
    return v instanceof Integer || v instanceof Long || v instanceof Short
        || v instanceof Byte || v instanceof BigInteger;
  }

  /** Human readable type of a value for diagnostics: the tag for built-ins, the class name otherwise. */
  public static String describe(Object v) {
    BuiltinType t = basicOf(v);
    return switch (t) {
      case OBJECT, HANDLE, CALLABLE -> t.id() + "(" + v.getClass().getName() + ")";
      default -> t.id();
    };
  }

  static boolean isFunctional(Class<?> c) {
    return CALLABLE.get(c);
  }

  private static boolean implementsFunctionalInterface(Class<?> c) {
    boolean lambda = c.isSynthetic() || c.isHidden();
    for (Class<?> k = c; k != null; k = k.getSuperclass()) {
      for (Class<?> i : k.getInterfaces()) {
        if (isCallableInterface(i, lambda)) return true;
      }
    }
    return false;
  }

  // A named class implementing e.g. TemporalAdjuster is still a plain object; only lambdas count
  // for arbitrary functional interfaces.
  private static boolean isCallableInterface(Class<?> i, boolean lambda) {
    if (i == Runnable.class || i == Callable.class || "java.util.function".equals(i.getPackageName())) return true;
    if (lambda && i.isAnnotationPresent(FunctionalInterface.class)) return true;
    for (Class<?> sup : i.getInterfaces()) {
      if (isCallableInterface(sup, lambda)) return true;
    }
    return false;
  }
}
