package com.gentoro.tasktree;

import com.gentoro.tasktree.exception.ConfigException;
import com.gentoro.tasktree.exception.SerializationException;
import com.gentoro.tasktree.utility.StringUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the engine configuration from YAML.
 *
 * <p>Locations: {@code classpath:<resource>}, a {@code file:} URI or a filesystem path; blank
 * means the bundled {@code application.yaml}. {@code ${env:NAME}} resolves from the process
 * environment first, then from a dotenv file: {@code $TASKTREE_ENV_FILE} when set, else {@code
 * .env.local} in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.tasktree.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private static final String CLASSPATH = "classpath:";

  private final String location;
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.location =
        StringUtility.isBlank(location) ? StartupParameters.DEFAULT_CONFIG : location.trim();
    this.configuration = load(this.location);
  }

  public Configuration config() {
    return configuration;
  }

  public String location() {
    return location;
  }

  private static Configuration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.getInterpolator().registerLookup("env", new DotenvLookup(dotenvFile()));
    if (location.startsWith(CLASSPATH)) {
      readResource(yaml, location.substring(CLASSPATH.length()));
    } else {
      readFile(yaml, toPath(location));
    }
    return yaml;
  }

  private static Path toPath(String location) {
    if (!location.regionMatches(true, 0, "file:", 0, 5)) return Path.of(location);
    try {
      return Path.of(URI.create(location));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration URI: " + location, e);
    }
  }

  private static void readResource(YAMLConfiguration yaml, String resource) {
    InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("Configuration resource {} not found on classpath; using defaults", resource);
      return;
    }
    log.info("Loading configuration from classpath resource {}", resource);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException("Failed to read YAML resource " + resource, e);
    }
  }

  private static void readFile(YAMLConfiguration yaml, Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file " + file, e);
    }
  }

  static Path dotenvFile() {
    String override = System.getenv("TASKTREE_ENV_FILE");
    return StringUtility.isBlank(override) ? Path.of(".env.local") : Path.of(override.trim());
  }

  /** Environment lookup falling back to a dotenv file, read once on the first miss. */
  static final class DotenvLookup implements Lookup {
    private final Path file;
    private volatile Map<String, String> fallback;

    DotenvLookup(Path file) {
      this.file = file;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) return value;
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      Map<String, String> values = fallback;
      if (values == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = Files.isRegularFile(file) ? parse(file) : Map.of();
          }
          values = fallback;
        }
      }
      return values;
    }

    /** {@code KEY=value} lines; blank lines, comments and an {@code export} prefix are allowed. */
    static Map<String, String> parse(Path file) {
      log.info("Reading environment fallback file {}", file.toAbsolutePath());
      Map<String, String> values = new HashMap<>();
      try {
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
          String line = raw.trim();
          if (line.isEmpty() || line.startsWith("#")) continue;
          if (line.startsWith("export ")) line = line.substring("export ".length()).trim();
          int eq = line.indexOf('=');
          if (eq <= 0) continue;
          values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
      } catch (IOException e) {
        log.warn("Could not read {}: {}", file.toAbsolutePath(), e.getMessage());
        return Map.of();
      }
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          return value.substring(1, value.length() - 1);
        }
      }
      return value;
    }
  }
}
