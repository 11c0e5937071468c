package com.gentoro.timeline;

import com.gentoro.timeline.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration.
 *
 * <p>The bundled {@code application.yaml} supplies every default. When a user file is given its
 * keys take precedence; keys it does not mention keep their defaults.
 */
public class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final CompositeConfiguration config;

  public ConfigurationProvider(Path userFile) {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (userFile != null) {
      composite.addConfiguration(readFile(userFile));
    }
    composite.addConfiguration(readDefaults());
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration readFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found").withContext("config", file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file", e).withContext("config", file);
    }
  }

  private static YAMLConfiguration readDefaults() {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new ConfigException("Missing bundled configuration: " + DEFAULT_RESOURCE);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read bundled configuration", e);
    }
  }

  private static YAMLConfiguration read(Reader reader) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration", e);
    }
    return yaml;
  }
}
