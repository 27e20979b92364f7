package com.onthegomap.buildingtiles.config;

import com.onthegomap.buildingtiles.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value settings of the tile server, read from command-line arguments, JVM properties, environmental variables or
 * a properties file.
 * <p>
 * Keys match regardless of case and of whether words are separated by {@code -}, {@code _} or {@code .}, so
 * {@code --min-zoom=12}, {@code min_zoom=12} and {@code MIN_ZOOM=12} all set {@code min_zoom}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "buildingtiles";
  private static final String ENV_PREFIX = "BUILDINGTILES";
  private static final Pattern WHOLE_SECONDS = Pattern.compile("\\d+");
  private static final Pattern MILLISECONDS = Pattern.compile("(\\d+)ms", Pattern.CASE_INSENSITIVE);

  private final UnaryOperator<String> lookup;
  private final Supplier<? extends Collection<String>> keys;

  private Arguments(UnaryOperator<String> lookup, Supplier<? extends Collection<String>> keys) {
    this.lookup = lookup;
    this.keys = keys;
  }

  /** Returns settings from JVM properties like {@code -Dbuildingtiles.port=9000}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return prefixed(getter, keys, JVM_PREFIX, ".", false);
  }

  /** Returns settings from environmental variables like {@code BUILDINGTILES_PORT=9000}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return prefixed(getter, keys, ENV_PREFIX, "_", true);
  }

  /**
   * Returns settings from command-line arguments.
   * <p>
   * Accepts {@code key=value}, {@code --key=value} and {@code --key value}. A flag without a value like
   * {@code --metrics} is {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int eq = arg.indexOf('=');
      if (eq >= 0) {
        parsed.put(stripDashes(arg.substring(0, eq)), arg.substring(eq + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  private static String stripDashes(String key) {
    return key.replaceFirst("^-+", "");
  }

  /**
   * Returns settings from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (String key : properties.stringPropertyNames()) {
      map.put(key, properties.getProperty(key));
    }
    return of(map);
  }

  /**
   * Returns the settings the server starts with, looking at command-line arguments first, then JVM properties, then
   * environmental variables, and finally the properties file that any of those names with {@code config}.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromEnvOrArgs(args);
    Path configFile = fromArgsOrEnv.file("config", "path to a properties file with more settings", null);
    return configFile == null ? fromArgsOrEnv : fromArgsOrEnv.orElse(fromConfigFile(configFile));
  }

  /** Returns command-line arguments, falling back to JVM properties and then to environmental variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get, normalized::keySet);
  }

  /** Shorthand for {@link #of(Map)} taking alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  private static Arguments prefixed(UnaryOperator<String> getter, Supplier<? extends Collection<String>> rawKeys,
    String prefix, String separator, boolean upperCase) {
    Pattern prefixPattern = Pattern.compile("^" + Pattern.quote(prefix + separator), Pattern.CASE_INSENSITIVE);
    Supplier<List<String>> keys = () -> rawKeys.get().stream()
      .filter(key -> prefixPattern.matcher(key).find())
      .map(key -> normalize(prefixPattern.matcher(key).replaceFirst("")))
      .toList();
    return new Arguments(key -> getter.apply(prefix + separator + (upperCase ? key.toUpperCase(Locale.ROOT) : key)),
      keys);
  }

  /** Returns settings that use {@code this} first and {@code other} for keys {@code this} does not have. */
  public Arguments orElse(Arguments other) {
    return new Arguments(
      key -> {
        String value = lookup.apply(key);
        return value != null ? value : other.lookup.apply(key);
      },
      () -> Stream.concat(keys.get().stream(), other.keys.get().stream()).distinct().toList()
    );
  }

  String getArg(String key) {
    String value = lookup.apply(normalize(key));
    return value == null ? null : value.strip();
  }

  private <T> T get(String key, String description, T defaultValue, Function<String, T> parse) {
    String raw = getArg(key);
    T result;
    if (raw == null) {
      result = defaultValue;
    } else {
      try {
        result = parse.apply(raw);
      } catch (NumberFormatException | DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
      }
    }
    LOGGER.debug("argument: {}={} ({})", key, result, description);
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    return get(key, description, defaultValue, Function.identity());
  }

  /** Returns a path, or {@code defaultValue} if the argument is not set. */
  public Path file(String key, String description, Path defaultValue) {
    return get(key, description, defaultValue, Path::of);
  }

  /** Returns true if the argument is {@code "true"} in any case, false for any other value. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return get(key, description, defaultValue, "true"::equalsIgnoreCase);
  }

  /**
   * Returns an integer argument.
   *
   * @throws IllegalArgumentException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    return get(key, description, defaultValue, Integer::parseInt);
  }

  /**
   * Returns a floating point argument.
   *
   * @throws IllegalArgumentException if the value is not a number
   */
  public double getDouble(String key, String description, double defaultValue) {
    return get(key, description, defaultValue, Double::parseDouble);
  }

  /**
   * Returns a duration written like {@code 5} or {@code 5s} for seconds, {@code 250ms}, {@code 10m} or {@code 1h30m}.
   *
   * @throws IllegalArgumentException if the value cannot be parsed
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    return get(key, description, parseDuration(defaultValue), Arguments::parseDuration);
  }

  private static Duration parseDuration(String value) {
    if (WHOLE_SECONDS.matcher(value).matches()) {
      return Duration.ofSeconds(Long.parseLong(value));
    }
    var millis = MILLISECONDS.matcher(value);
    if (millis.matches()) {
      return Duration.ofMillis(Long.parseLong(millis.group(1)));
    }
    return Duration.parse("PT" + value);
  }

  /** Returns the number of request worker threads, the number of processors unless {@code threads} is set. */
  public int threads() {
    return Math.max(2, getInteger("threads", "request worker threads", Runtime.getRuntime().availableProcessors()));
  }

  /**
   * Returns prometheus stats that the server exposes on {@code /metrics}, or in-memory stats when {@code metrics} is
   * false.
   */
  public Stats getStats() {
    if (getBoolean("metrics", "expose prometheus metrics on /metrics", true)) {
      LOGGER.info("argument: stats=use prometheus stats");
      return Stats.prometheus();
    } else {
      LOGGER.info("argument: stats=use in-memory stats");
      return Stats.inMemory();
    }
  }

  /** Returns every argument that is set, keyed by its normalized name. */
  public Map<String, String> toMap() {
    Map<String, String> result = new TreeMap<>();
    for (String key : keys.get()) {
      result.put(normalize(key), getArg(key));
    }
    return result;
  }
}
