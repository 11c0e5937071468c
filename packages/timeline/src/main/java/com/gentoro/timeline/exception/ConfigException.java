package com.gentoro.timeline.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends TimelineException {
  public ConfigException(String message) {
    super(TimelineErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TimelineErrorCode.CONFIG_ERROR, message, cause);
  }
}
