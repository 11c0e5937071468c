package com.gentoro.timeline.utility;

import com.gentoro.timeline.exception.IoException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Small collection of I/O helpers. */
public final class IoUtil {

  private IoUtil() {}

  /** Write {@code content} as UTF-8, creating missing parent directories. */
  public static Path writeString(Path dest, String content) {
    try {
      Path parent = dest.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      return Files.writeString(dest, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write output", e).withContext("output", dest);
    }
  }

  /** Read a UTF-8 classpath resource. */
  public static String readResource(String name) {
    try (InputStream in = IoUtil.class.getClassLoader().getResourceAsStream(name)) {
      if (in == null) {
        throw new IoException("Missing classpath resource: " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read classpath resource " + name, e);
    }
  }
}
