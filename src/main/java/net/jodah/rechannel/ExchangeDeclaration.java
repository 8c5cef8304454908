package net.jodah.rechannel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import net.jodah.rechannel.internal.util.Assert;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * The parameters an exchange is declared with. Instances are immutable; each {@code withX} method
 * returns a copy.
 */
public final class ExchangeDeclaration {
  private final String name;
  private final String type;
  private final boolean durable;
  private final boolean autoDelete;
  private final boolean internal;
  private final boolean passive;
  private final Map<String, Object> arguments;

  /**
   * Creates a declaration for a non-durable direct exchange named {@code name}.
   */
  public ExchangeDeclaration(String name) {
    this(Assert.notNull(name, "name"), BuiltinExchangeType.DIRECT.getType(), false, false, false,
        false, null);
  }

  private ExchangeDeclaration(String name, String type, boolean durable, boolean autoDelete,
      boolean internal, boolean passive, Map<String, Object> arguments) {
    this.name = name;
    this.type = type;
    this.durable = durable;
    this.autoDelete = autoDelete;
    this.internal = internal;
    this.passive = passive;
    this.arguments = arguments == null ? null : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(
        arguments));
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public boolean isDurable() {
    return durable;
  }

  public boolean isAutoDelete() {
    return autoDelete;
  }

  /**
   * Returns whether the exchange is internal. Internal exchanges cannot be published to directly
   * and are never remembered for recovery.
   */
  public boolean isInternal() {
    return internal;
  }

  public boolean isPassive() {
    return passive;
  }

  /**
   * Returns the declaration arguments, else null if there are none.
   */
  public Map<String, Object> getArguments() {
    return arguments;
  }

  public ExchangeDeclaration withType(String type) {
    return new ExchangeDeclaration(name, Assert.notNull(type, "type"), durable, autoDelete,
        internal, passive, arguments);
  }

  public ExchangeDeclaration withType(BuiltinExchangeType type) {
    return withType(Assert.notNull(type, "type").getType());
  }

  public ExchangeDeclaration withDurable(boolean durable) {
    return new ExchangeDeclaration(name, type, durable, autoDelete, internal, passive, arguments);
  }

  public ExchangeDeclaration withAutoDelete(boolean autoDelete) {
    return new ExchangeDeclaration(name, type, durable, autoDelete, internal, passive, arguments);
  }

  public ExchangeDeclaration withInternal(boolean internal) {
    return new ExchangeDeclaration(name, type, durable, autoDelete, internal, passive, arguments);
  }

  public ExchangeDeclaration withPassive(boolean passive) {
    return new ExchangeDeclaration(name, type, durable, autoDelete, internal, passive, arguments);
  }

  public ExchangeDeclaration withArguments(Map<String, Object> arguments) {
    return new ExchangeDeclaration(name, type, durable, autoDelete, internal, passive, arguments);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((arguments == null) ? 0 : arguments.hashCode());
    result = prime * result + (autoDelete ? 1231 : 1237);
    result = prime * result + (durable ? 1231 : 1237);
    result = prime * result + (internal ? 1231 : 1237);
    result = prime * result + name.hashCode();
    result = prime * result + (passive ? 1231 : 1237);
    result = prime * result + type.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    ExchangeDeclaration other = (ExchangeDeclaration) obj;
    if (arguments == null) {
      if (other.arguments != null)
        return false;
    } else if (!arguments.equals(other.arguments))
      return false;
    return name.equals(other.name) && type.equals(other.type) && durable == other.durable
        && autoDelete == other.autoDelete && internal == other.internal && passive == other.passive;
  }

  @Override
  public String toString() {
    return "ExchangeDeclaration [name=" + name + ", type=" + type + "]";
  }
}
