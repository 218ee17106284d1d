package com.redline.util;

/** Utility class for decorating lifecycle log messages with ANSI colors. */
public class LogUtil {

  /** ANSI colors used by the framework's console output. */
  public enum Color {
    RESET("\033[0m"),
    RED("\033[0;31m"),
    GREEN("\033[0;32m"),
    YELLOW("\033[0;33m"),
    BLUE("\033[0;34m"),
    PURPLE("\033[0;35m"),
    CYAN("\033[0;36m"),
    WHITE("\033[0;37m"),
    RED_BOLD("\033[1;31m"),
    GREEN_BOLD("\033[1;32m"),
    YELLOW_BOLD("\033[1;33m"),
    CYAN_BOLD("\033[1;36m"),
    WHITE_BOLD("\033[1;37m");

    private final String code;

    Color(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  /**
   * Creates a debug message tagged in cyan.
   *
   * @param message the log message
   * @return the colored message
   */
  public static String debug(String message) {
    return tag("DEBUG", Color.CYAN, message);
  }

  /**
   * Creates an info message tagged in green.
   *
   * @param message the log message
   * @return the colored message
   */
  public static String info(String message) {
    return tag("INFO", Color.GREEN, message);
  }

  /**
   * Creates a warning message tagged in yellow.
   *
   * @param message the log message
   * @return the colored message
   */
  public static String warn(String message) {
    return tag("WARN", Color.YELLOW, message);
  }

  /**
   * Creates an error message tagged in red.
   *
   * @param message the log message
   * @return the colored message
   */
  public static String error(String message) {
    return tag("ERROR", Color.RED, message);
  }

  /**
   * Wraps a fragment of a message in the given color.
   *
   * @param text the fragment
   * @param color the color
   * @return the colored fragment, reset afterwards
   */
  public static String highlight(Object text, Color color) {
    return color.code() + text + Color.RESET.code();
  }

  private static String tag(String level, Color color, String message) {
    // Format: [LEVEL] message; the logging backend adds the timestamp
    return new StringBuilder()
        .append(color.code())
        .append("[")
        .append(level)
        .append("]")
        .append(Color.RESET.code())
        .append(" ")
        .append(message)
        .toString();
  }
}
