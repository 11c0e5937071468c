package com.gentoro.timeline.exception;

/** Errors while reading trace input or writing rendered artifacts. */
public class IoException extends TimelineException {
  public IoException(String message) {
    super(TimelineErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(TimelineErrorCode.IO_ERROR, message, cause);
  }
}
