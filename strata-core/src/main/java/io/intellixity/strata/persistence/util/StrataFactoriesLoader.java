package io.intellixity.strata.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Instantiates the implementations registered for an extension point in the
 * {@code META-INF/strata.factories} resources of a class loader.
 * <pre>
 * io.intellixity.strata.persistence.spi.StorageProvider=com.acme.MyProvider,com.acme.OtherProvider
 * </pre>
 * An implementation named by several resources is instantiated once, in the position of its first
 * declaration. Implementations need a no-argument constructor.
 */
public final class StrataFactoriesLoader {
  public static final String RESOURCE = "META-INF/strata.factories";

  private StrataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> extensionPoint) {
    return load(extensionPoint, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> extensionPoint, ClassLoader cl) {
    Objects.requireNonNull(extensionPoint, "extensionPoint");
    ClassLoader loader = (cl != null) ? cl : StrataFactoriesLoader.class.getClassLoader();

    List<T> out = new ArrayList<>();
    for (Map.Entry<String, URL> d : declarations(extensionPoint.getName(), loader).entrySet()) {
      out.add(instantiate(extensionPoint, d.getKey(), d.getValue(), loader));
    }
    return out;
  }

  // implementation class name -> resource that first declared it
  private static Map<String, URL> declarations(String key, ClassLoader loader) {
    Map<String, URL> names = new LinkedHashMap<>();
    for (URL url : resources(loader)) {
      String value = read(url).getProperty(key, "");
      for (String part : value.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.putIfAbsent(name, url);
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      return Collections.list(loader.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(Class<T> extensionPoint, String name, URL source, ClassLoader loader) {
    Class<?> type;
    try {
      type = Class.forName(name, false, loader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(name + " declared in " + source + " is not on the classpath", e);
    }
    if (!extensionPoint.isAssignableFrom(type)) {
      throw new IllegalArgumentException(name + " declared in " + source + " is not a " + extensionPoint.getName());
    }
    try {
      return extensionPoint.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + name + " declared in " + source, e);
    }
  }
}
