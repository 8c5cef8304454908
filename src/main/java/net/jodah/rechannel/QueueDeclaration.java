package net.jodah.rechannel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import net.jodah.rechannel.internal.util.Assert;

/**
 * The parameters a queue is declared with. Instances are immutable; each {@code withX} method
 * returns a copy.
 */
public final class QueueDeclaration {
  private final String name;
  private final boolean durable;
  private final boolean exclusive;
  private final boolean autoDelete;
  private final boolean passive;
  private final Map<String, Object> arguments;

  /**
   * Creates a declaration for a queue with a server generated name.
   */
  public QueueDeclaration() {
    this("");
  }

  /**
   * Creates a declaration for a non-durable queue named {@code name}. An empty name has the broker
   * generate one.
   */
  public QueueDeclaration(String name) {
    this(Assert.notNull(name, "name"), false, false, false, false, null);
  }

  private QueueDeclaration(String name, boolean durable, boolean exclusive, boolean autoDelete,
      boolean passive, Map<String, Object> arguments) {
    this.name = name;
    this.durable = durable;
    this.exclusive = exclusive;
    this.autoDelete = autoDelete;
    this.passive = passive;
    this.arguments = arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(
        arguments));
  }

  /**
   * Returns the declared name, which is empty when the broker is to generate the name.
   */
  public String getName() {
    return name;
  }

  public boolean isServerNamed() {
    return name.isEmpty();
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  public boolean isAutoDelete() {
    return autoDelete;
  }

  public boolean isPassive() {
    return passive;
  }

  public Map<String, Object> getArguments() {
    return arguments;
  }

  public QueueDeclaration withDurable(boolean durable) {
    return new QueueDeclaration(name, durable, exclusive, autoDelete, passive, arguments);
  }

  public QueueDeclaration withExclusive(boolean exclusive) {
    return new QueueDeclaration(name, durable, exclusive, autoDelete, passive, arguments);
  }

  public QueueDeclaration withAutoDelete(boolean autoDelete) {
    return new QueueDeclaration(name, durable, exclusive, autoDelete, passive, arguments);
  }

  public QueueDeclaration withPassive(boolean passive) {
    return new QueueDeclaration(name, durable, exclusive, autoDelete, passive, arguments);
  }

  public QueueDeclaration withArguments(Map<String, Object> arguments) {
    return new QueueDeclaration(name, durable, exclusive, autoDelete, passive, arguments);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((arguments == null) ? 0 : arguments.hashCode());
    result = prime * result + (autoDelete ? 1231 : 1237);
    result = prime * result + (durable ? 1231 : 1237);
    result = prime * result + (exclusive ? 1231 : 1237);
    result = prime * result + name.hashCode();
    result = prime * result + (passive ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    QueueDeclaration other = (QueueDeclaration) obj;
    if (arguments == null) {
      if (other.arguments != null)
        return false;
    } else if (!arguments.equals(other.arguments))
      return false;
    return name.equals(other.name) && durable == other.durable && exclusive == other.exclusive
        && autoDelete == other.autoDelete && passive == other.passive;
  }

  @Override
  public String toString() {
    return "QueueDeclaration [name=" + name + "]";
  }
}
