package com.gentoro.timeline.exception;

/** Errors while starting or running the embedded HTTP viewer. */
public class NetworkException extends TimelineException {
  public NetworkException(String message) {
    super(TimelineErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(TimelineErrorCode.NETWORK_ERROR, message, cause);
  }
}
