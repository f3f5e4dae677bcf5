package com.gentoro.injob;

import com.gentoro.injob.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration from a YAML file, or from {@code application.yaml} on the
 * classpath when no file is given.
 */
public final class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private static final org.slf4j.Logger log =
      com.gentoro.injob.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path file) {
    this.config = file == null ? loadResource(DEFAULT_RESOURCE) : loadFile(file);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("No {} on the classpath, using built-in defaults", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read classpath configuration " + resource, e);
    }
  }

  static YAMLConfiguration read(Reader reader) {
    YAMLConfiguration cfg = new YAMLConfiguration();
    try {
      cfg.read(reader);
    } catch (Exception e) {
      throw new ConfigException("Invalid YAML configuration", e);
    }
    return cfg;
  }
}
