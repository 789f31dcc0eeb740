package com.consullo.pipes.config;

import java.io.InputStream;
import java.util.Properties;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning values for mailboxes, pumps and process teardown.
 *
 * <p>Values are read once from {@code consullo-pipes.properties} on the classpath by {@link #load()}; any key that is
 * missing or unparsable falls back to the built-in default.
 *
 * @param mailboxCapacity number of chunks a mailbox holds before {@code send} blocks (at least 1)
 * @param readChunkSize maximum number of bytes an output pump reads from a handle per chunk
 * @param terminateGraceMillis milliseconds to wait after a polite destroy before destroying forcibly
 * @param pumpJoinMillis milliseconds scope teardown waits for a pump thread to finish on its own
 * @param programName name printed at the start of default diagnostics
 * @since 1.0
 */
public record PipesConfig(
    int mailboxCapacity,
    int readChunkSize,
    long terminateGraceMillis,
    long pumpJoinMillis,
    String programName) {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipesConfig.class);

  public static final String PROPS_RESOURCE = "consullo-pipes.properties";

  public static final int DEFAULT_MAILBOX_CAPACITY = 1;
  public static final int DEFAULT_READ_CHUNK_SIZE = 1024;
  public static final long DEFAULT_TERMINATE_GRACE_MILLIS = 2_000L;
  public static final long DEFAULT_PUMP_JOIN_MILLIS = 2_000L;

  public PipesConfig {
    Validate.isTrue(mailboxCapacity >= 1, "mailboxCapacity must be at least 1");
    Validate.isTrue(readChunkSize > 0, "readChunkSize must be positive");
    Validate.isTrue(terminateGraceMillis >= 0, "terminateGraceMillis must not be negative");
    Validate.isTrue(pumpJoinMillis >= 0, "pumpJoinMillis must not be negative");
    Validate.notBlank(programName, "programName must not be blank");
  }

  /**
   * Returns the built-in defaults without consulting the classpath.
   *
   * @return default configuration
   */
  public static PipesConfig defaults() {
    return new PipesConfig(
        DEFAULT_MAILBOX_CAPACITY,
        DEFAULT_READ_CHUNK_SIZE,
        DEFAULT_TERMINATE_GRACE_MILLIS,
        DEFAULT_PUMP_JOIN_MILLIS,
        defaultProgramName());
  }

  /**
   * Loads the configuration from {@value #PROPS_RESOURCE}, falling back to defaults for absent keys.
   *
   * @return loaded configuration
   */
  public static PipesConfig load() {
    return fromProperties(loadProps());
  }

  /**
   * Builds a configuration from already loaded properties.
   *
   * @param p properties using the keys of {@value #PROPS_RESOURCE}
   * @return configuration
   */
  public static PipesConfig fromProperties(final Properties p) {
    Validate.notNull(p, "properties must not be null");
    final String rawName = p.getProperty("programName", "").trim();
    return new PipesConfig(
        Math.max(1, parseInt(p, "mailboxCapacity", DEFAULT_MAILBOX_CAPACITY)),
        Math.max(1, parseInt(p, "readChunkSize", DEFAULT_READ_CHUNK_SIZE)),
        Math.max(0L, parseLong(p, "terminateGraceMillis", DEFAULT_TERMINATE_GRACE_MILLIS)),
        Math.max(0L, parseLong(p, "pumpJoinMillis", DEFAULT_PUMP_JOIN_MILLIS)),
        rawName.isEmpty() ? defaultProgramName() : rawName);
  }

  /**
   * Returns a copy with a different mailbox capacity.
   *
   * @param capacity new capacity
   * @return updated configuration
   */
  public PipesConfig withMailboxCapacity(final int capacity) {
    return new PipesConfig(capacity, readChunkSize, terminateGraceMillis, pumpJoinMillis, programName);
  }

  /**
   * Returns a copy with a different read chunk size.
   *
   * @param size new chunk size in bytes
   * @return updated configuration
   */
  public PipesConfig withReadChunkSize(final int size) {
    return new PipesConfig(mailboxCapacity, size, terminateGraceMillis, pumpJoinMillis, programName);
  }

  /**
   * Returns a copy with a different program name.
   *
   * @param name new program name
   * @return updated configuration
   */
  public PipesConfig withProgramName(final String name) {
    return new PipesConfig(mailboxCapacity, readChunkSize, terminateGraceMillis, pumpJoinMillis, name);
  }

  /**
   * Best guess at the running program's name: the simple name of the main class, or {@code java}.
   */
  static String defaultProgramName() {
    final String command = System.getProperty("sun.java.command", "").trim();
    if (command.isEmpty()) {
      return "java";
    }
    String first = command;
    final int space = command.indexOf(' ');
    if (space > 0) {
      first = command.substring(0, space);
    }
    if (first.endsWith(".jar")) {
      final int slash = Math.max(first.lastIndexOf('/'), first.lastIndexOf('\\'));
      return first.substring(slash + 1);
    }
    final int dot = first.lastIndexOf('.');
    final String simple = dot >= 0 ? first.substring(dot + 1) : first;
    return simple.isBlank() ? "java" : simple;
  }

  private static Properties loadProps() {
    final Properties p = new Properties();
    try (InputStream in = PipesConfig.class.getClassLoader().getResourceAsStream(PROPS_RESOURCE)) {
      if (in != null) {
        p.load(in);
      } else {
        LOGGER.debug("{} not found on classpath, using built-in defaults", PROPS_RESOURCE);
      }
    } catch (final Exception e) {
      LOGGER.warn("Could not load {}: {}", PROPS_RESOURCE, e.getMessage());
    }
    return p;
  }

  private static int parseInt(final Properties p, final String key, final int def) {
    try {
      return Integer.parseInt(p.getProperty(key, String.valueOf(def)).trim());
    } catch (final NumberFormatException e) {
      LOGGER.warn("Invalid value for {}, using default {}", key, def);
      return def;
    }
  }

  private static long parseLong(final Properties p, final String key, final long def) {
    try {
      return Long.parseLong(p.getProperty(key, String.valueOf(def)).trim());
    } catch (final NumberFormatException e) {
      LOGGER.warn("Invalid value for {}, using default {}", key, def);
      return def;
    }
  }
}
