package com.gentoro.timeline.exception;

/** Failures while serializing a timeline document. */
public class RenderException extends TimelineException {
  public RenderException(String message) {
    super(TimelineErrorCode.RENDER_ERROR, message);
  }

  public RenderException(String message, Throwable cause) {
    super(TimelineErrorCode.RENDER_ERROR, message, cause);
  }
}
