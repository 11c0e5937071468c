package com.gentoro.timeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.timeline.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path temp;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(1400, config.getInt("layout.width-px"));
    assertEquals("μs", config.getString("render.time-unit"));
    assertEquals(8080, config.getInt("http.port"));
  }

  @Test
  void userFileWinsAndDefaultsFillTheRest() throws Exception {
    Path file = temp.resolve("app.yaml");
    Files.writeString(file, "layout:\n  width-px: 900\nhttp:\n  port: 9090\n");

    Configuration config = new ConfigurationProvider(file).config();

    assertEquals(900, config.getInt("layout.width-px"));
    assertEquals(20, config.getInt("layout.row-height"));
    assertEquals(9090, config.getInt("http.port"));
  }

  @Test
  void missingFileIsAConfigError() {
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(temp.resolve("no.yaml")));
  }

  @Test
  void invalidYamlIsAConfigError() throws Exception {
    Path file = temp.resolve("bad.yaml");
    Files.writeString(file, "layout: [unclosed\n");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(file));
  }
}
