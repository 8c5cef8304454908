package net.jodah.rechannel.internal.util;

/**
 * Argument and state assertions.
 */
public final class Assert {
  private Assert() {
  }

  public static void isTrue(boolean expression, String errorMessageFormat, Object... args) {
    if (!expression)
      throw new IllegalArgumentException(format(errorMessageFormat, args));
  }

  public static <T> T notNull(T reference, String parameterName) {
    if (reference == null)
      throw new NullPointerException(parameterName + " cannot be null");
    return reference;
  }

  public static void state(boolean expression, String errorMessageFormat, Object... args) {
    if (!expression)
      throw new IllegalStateException(format(errorMessageFormat, args));
  }

  /** Replaces each {@code {}} in the {@code format} with the next of the {@code args}. */
  static String format(String format, Object... args) {
    StringBuilder sb = new StringBuilder(format.length() + 16);
    int start = 0;
    for (Object arg : args) {
      int placeholder = format.indexOf("{}", start);
      if (placeholder == -1)
        break;
      sb.append(format, start, placeholder).append(arg);
      start = placeholder + 2;
    }

    return sb.append(format.substring(start)).toString();
  }
}
