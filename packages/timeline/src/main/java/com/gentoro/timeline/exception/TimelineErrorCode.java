package com.gentoro.timeline.exception;

/** Broad error categories reported by {@link TimelineException}. */
public enum TimelineErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  IO_ERROR,
  RENDER_ERROR,
  NETWORK_ERROR
}
