package com.gentoro.timeline.render;

import java.nio.charset.StandardCharsets;

/**
 * A rendered document.
 *
 * @param fileName default file name when written to disk
 */
public record RenderedArtifact(String content, String mediaType, String fileName) {

  public byte[] bytes() {
    return content.getBytes(StandardCharsets.UTF_8);
  }
}
