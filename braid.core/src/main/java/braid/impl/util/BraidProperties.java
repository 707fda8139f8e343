package braid.impl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tuning knobs read from JVM properties, falling back to environment variables
 * ({@code braid.rope.chunk-base} is also looked up as {@code BRAID_ROPE_CHUNK_BASE}).
 * Values are parsed once and cached until {@link #refresh()}.
 */
public class BraidProperties {
  private static final Logger log = LoggerFactory.getLogger(BraidProperties.class);
  private static final Map<String, Object> PROP_CACHE = new ConcurrentHashMap<>();

  public static final String ROPE_CHUNK_BASE = "braid.rope.chunk-base";
  public static final String TREE_BRANCHING = "braid.tree.branching";

  public static final int DEF_ROPE_CHUNK_BASE = 64;
  public static final int DEF_TREE_BRANCHING = 32;

  public static final int MIN_ROPE_CHUNK_BASE = 2;
  public static final int MIN_TREE_BRANCHING = 4;

  protected interface Parser<T> {
    T parse(String source, String value) throws IllegalArgumentException;
  }

  protected static <T> T readPropertyExternally(String propertyName, T defaultValue, Parser<T> parser) {
    String source = "JVM property " + propertyName;
    String value = System.getProperty(propertyName);
    if (value == null) {
      String envName = propertyName.toUpperCase().replace('.', '_').replace('-', '_');
      source = "Environment var " + envName;
      value = System.getenv(envName);
    }
    if (value == null) {
      return defaultValue;
    }
    T parsed = parser.parse(source, value);
    log.debug("{}={} overrides default {}", source, parsed, defaultValue);
    return parsed;
  }

  protected static <T> T readProperty(String propertyName, T defaultValue, Parser<T> parser) {
    //noinspection unchecked
    return (T)PROP_CACHE.computeIfAbsent(propertyName,
                                         k -> readPropertyExternally(k, defaultValue, parser));
  }

  protected static int readIntAtLeast(String propertyName, int defaultValue, int min) {
    return readProperty(propertyName, defaultValue, (src, val) -> {
      int i;
      try {
        i = Integer.parseInt(val.trim());
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException(src + "=" + val + " is not an integer", e);
      }
      if (i < min)
        throw new IllegalArgumentException(src + "=" + val + " is not an integer >= " + min);
      return i;
    });
  }

  /**
   * Drops all cached property values, causing properties to be re-read from
   * {@link System#getProperty(String)} and {@link System#getenv(String)}.
   */
  public static void refresh() {
    PROP_CACHE.clear();
  }

  /**
   * Size unit of rope leaves: a chunk holds at most twice this many bytes, and every chunk but the last
   * holds at least this many bytes minus the width of one partial character.
   *
   * <p>The default value is {@link BraidProperties#DEF_ROPE_CHUNK_BASE}.</p>
   */
  public static int chunkBase() {
    return readIntAtLeast(ROPE_CHUNK_BASE, DEF_ROPE_CHUNK_BASE, MIN_ROPE_CHUNK_BASE);
  }

  /**
   * Maximum number of children of a tree node. Nodes off the spines hold at least half of it.
   *
   * <p>The default value is {@link BraidProperties#DEF_TREE_BRANCHING}.</p>
   */
  public static int treeBranching() {
    return readIntAtLeast(TREE_BRANCHING, DEF_TREE_BRANCHING, MIN_TREE_BRANCHING);
  }
}
