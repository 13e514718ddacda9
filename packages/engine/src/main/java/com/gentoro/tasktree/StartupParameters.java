package com.gentoro.tasktree;

import com.gentoro.tasktree.utility.StringUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Command line options of the engine, given as {@code --name value}, {@code --name=value} or a
 * bare {@code --flag}. Besides {@code --config-file}, a few options override configuration keys:
 *
 * <pre>
 *   --strict                  hierarchy.strictMode = true
 *   --prefix-length 128       prefix.length
 *   --vector-store qdrant     vectorstore.provider
 *   --embeddings openai       embedding.provider
 * </pre>
 */
public class StartupParameters {
  public static final String DEFAULT_CONFIG = "classpath:application.yaml";

  private static final Map<String, String> OVERRIDES =
      Map.of(
          "strict", "hierarchy.strictMode",
          "prefix-length", "prefix.length",
          "vector-store", "vectorstore.provider",
          "embeddings", "embedding.provider");

  private final Map<String, String> options;

  public StartupParameters(String... arguments) {
    this.options =
        Collections.unmodifiableMap(parse(arguments == null ? new String[0] : arguments));
    validate();
  }

  private static Map<String, String> parse(String[] arguments) {
    Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i < arguments.length; i++) {
      String arg = arguments[i];
      if (arg == null || !arg.startsWith("--")) continue;
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        result.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < arguments.length && !arguments[i + 1].startsWith("--")) {
        result.put(body, arguments[++i]);
      } else {
        result.put(body, null);
      }
    }
    return result;
  }

  private void validate() {
    if (options.containsKey("config-file") && StringUtility.isBlank(options.get("config-file"))) {
      throw new IllegalArgumentException("--config-file needs a location");
    }
    for (String option : OVERRIDES.keySet()) {
      if (!option.equals("strict")
          && options.containsKey(option)
          && StringUtility.isBlank(options.get(option))) {
        throw new IllegalArgumentException("--" + option + " needs a value");
      }
    }
  }

  /** Configuration location, e.g. "classpath:application.yaml" or "/etc/tasktree.yaml". */
  public String configFile() {
    String location = options.get("config-file");
    return location == null ? DEFAULT_CONFIG : location.trim();
  }

  public Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  public boolean isPresent(String name) {
    return options.containsKey(name);
  }

  /** Writes the overriding options given on the command line into {@code config}. */
  public void applyOverrides(Configuration config) {
    OVERRIDES.forEach(
        (option, key) -> {
          if (!options.containsKey(option)) return;
          String value = options.get(option);
          config.setProperty(key, value == null ? "true" : value.trim());
        });
  }
}
