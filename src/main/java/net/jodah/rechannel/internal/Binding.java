package net.jodah.rechannel.internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encapsulates a binding from a source exchange to the entity that remembers it.
 */
public final class Binding {
  public final String source;
  public final String routingKey;
  public final Map<String, Object> arguments;

  public Binding(String source, String routingKey, Map<String, Object> arguments) {
    this.source = source;
    this.routingKey = routingKey;
    this.arguments = arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(
        arguments));
  }

  @Override
  public int hashCode() {
    int result = source == null ? 0 : source.hashCode();
    result = 31 * result + (routingKey == null ? 0 : routingKey.hashCode());
    return 31 * result + (arguments == null ? 0 : arguments.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Binding))
      return false;
    Binding other = (Binding) obj;
    return equal(source, other.source) && equal(routingKey, other.routingKey)
        && equal(arguments, other.arguments);
  }

  @Override
  public String toString() {
    return "Binding [source=" + source + ", routingKey=" + routingKey + "]";
  }

  private static boolean equal(Object a, Object b) {
    return a == null ? b == null : a.equals(b);
  }
}
