package io.intellixity.typeset.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.URL;
import java.util.*;

/**
 * Discovers typeset extensions listed in {@code META-INF/typeset.factories}.
 *
 * <p>Every copy of the resource on the classpath is read as a properties file mapping an
 * extension interface to a comma separated list of implementations:</p>
 *
 * <pre>
 * io.intellixity.typeset.types.CapabilityProvider=com.acme.MoneyTraits, com.acme.GeoTraits
 * </pre>
 *
 * An implementation listed more than once is created once, at its first position. Errors name
 * the resource that listed the offending class.
 */
public final class TypesetFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(TypesetFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/typeset.factories";

  private TypesetFactoriesLoader() {}

  /** Loads through the thread context class loader. */
  public static <T> List<T> load(Class<T> extension) {
    return load(extension, Thread.currentThread().getContextClassLoader());
  }

  /**
   * @param loader class loader to search; null means the loader of this class
   * @throws IllegalStateException if a resource cannot be read or a listed class cannot be created
   */
  public static <T> List<T> load(Class<T> extension, ClassLoader loader) {
    Objects.requireNonNull(extension, "extension");
    ClassLoader cl = loader != null ? loader : TypesetFactoriesLoader.class.getClassLoader();

    Map<String, URL> listed = listedImplementations(extension.getName(), cl);
    List<T> out = new ArrayList<>(listed.size());
    listed.forEach((name, origin) -> out.add(create(extension, name, origin, cl)));

    if (log.isDebugEnabled()) {
      log.debug("typeset.factories extension={} implementations={}", extension.getName(), listed.keySet());
    }
    return out;
  }

  // implementation class name -> resource that first listed it, in listing order
  private static Map<String, URL> listedImplementations(String key, ClassLoader cl) {
    List<URL> resources;
    try {
      resources = Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE + " resources", e);
    }

    Map<String, URL> listed = new LinkedHashMap<>();
    for (URL url : resources) {
      String value = read(url).getProperty(key, "");
      Arrays.stream(value.split(","))
          .map(String::trim)
          .filter(name -> !name.isEmpty())
          .forEach(name -> listed.putIfAbsent(name, url));
    }
    return listed;
  }

  private static Properties read(URL url) {
    Properties props = new Properties();
    try (InputStream in = url.openStream()) {
      props.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return props;
  }

  private static <T> T create(Class<T> extension, String name, URL origin, ClassLoader cl) {
    Class<?> impl;
    try {
      impl = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(name + " listed in " + origin + " is not on the classpath", e);
    }
    if (!extension.isAssignableFrom(impl)) {
      throw new IllegalStateException(name + " listed in " + origin + " does not implement " + extension.getName());
    }

    Constructor<?> ctor;
    try {
      ctor = impl.getDeclaredConstructor();
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException(name + " listed in " + origin + " has no no-arg constructor", e);
    }
    try {
      return extension.cast(ctor.newInstance());
    } catch (InvocationTargetException e) {
      throw new IllegalStateException(name + " failed in its constructor", e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + name + " listed in " + origin, e);
    }
  }
}
