package com.gentoro.timeline.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void prefersTimelineMessageAlongCauseChain() {
    IoException io = new IoException("Failed to read trace input", new IOException("denied"));
    RuntimeException wrapper = new RuntimeException("outer", io);

    assertEquals(
        "Failed to read trace input (denied)", ExceptionUtil.extractErrorMessage(wrapper));
  }

  @Test
  void fallsBackToTypeAndMessage() {
    assertEquals(
        "IllegalStateException: broken",
        ExceptionUtil.extractErrorMessage(new IllegalStateException("broken")));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void summaryCarriesAttachedPaths() {
    TimelineException e =
        new IoException("Failed to write output", new IOException("read-only"))
            .withContext("output", Path.of("out", "trace.html"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(e);

    assertEquals("IoException", details.type());
    assertEquals(TimelineErrorCode.IO_ERROR, details.code());
    assertEquals(
        "Failed to write output (read-only) [output=" + Path.of("out", "trace.html") + "]",
        details.summary());
  }

  @Test
  void contextIsMergedAcrossWrappedExceptionsOuterFirst() {
    TimelineException inner =
        new IoException("Failed to read trace input")
            .withContext("input", "a.csv")
            .withContext("port", 1);
    TimelineException outer =
        new NetworkException("Could not serve", inner).withContext("port", 8080);

    ErrorDetails details = ExceptionUtil.toErrorDetails(new RuntimeException("wrapped", outer));

    assertEquals("NetworkException", details.type());
    assertEquals(TimelineErrorCode.NETWORK_ERROR, details.code());
    assertEquals(8080, details.context().get("port"));
    assertEquals("a.csv", details.context().get("input"));
    assertEquals("Could not serve (Failed to read trace input)", details.message());
  }

  @Test
  void foreignFailuresAreUnknownWithRootOrigin() {
    IllegalStateException root = new IllegalStateException("boom");
    ErrorDetails details = ExceptionUtil.toErrorDetails(new RuntimeException(root));

    assertEquals(TimelineErrorCode.UNKNOWN, details.code());
    assertEquals("RuntimeException", details.type());
    assertTrue(details.context().isEmpty());
    assertEquals(root.getStackTrace()[0].toString(), details.origin());
    assertEquals("Unknown error", ExceptionUtil.toErrorDetails(null).summary());
  }
}
