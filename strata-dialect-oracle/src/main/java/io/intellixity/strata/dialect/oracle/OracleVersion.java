package io.intellixity.strata.dialect.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Oracle server version as far as SQL generation cares: major and minor.\n
 * {@code 11.2.0.4} parses as 11.2; anything unparseable falls back to {@link #DEFAULT}.
 */
public record OracleVersion(int major, int minor) implements Comparable<OracleVersion> {
  private static final Logger log = LoggerFactory.getLogger(OracleVersion.class);
  private static final Pattern VERSION = Pattern.compile("^(\\d+)(?:\\.(\\d+))?(?:\\.\\d+)*$");

  /** Used when no version is configured. */
  public static final OracleVersion DEFAULT = new OracleVersion(19, 0);

  public OracleVersion {
    if (major < 1 || minor < 0) throw new IllegalArgumentException("Invalid Oracle version " + major + "." + minor);
  }

  public static OracleVersion parse(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULT;
    Matcher m = VERSION.matcher(raw.trim());
    if (m.matches()) {
      try {
        int major = Integer.parseInt(m.group(1));
        int minor = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        if (major >= 1) return new OracleVersion(major, minor);
      } catch (NumberFormatException e) {
        log.debug("strata.dialect oracle version={} parse failed: {}", raw, e.getMessage());
      }
    }
    log.warn("strata.dialect oracle version={} unrecognized, using default={}", raw, DEFAULT);
    return DEFAULT;
  }

  /** {@code OFFSET ... FETCH NEXT} exists from 12c on. */
  public boolean supportsFetchClause() { return major >= 12; }

  /** 128-byte identifiers from 12.2 on, 30 before. */
  public int maxIdentifierLength() { return isAtLeast(12, 2) ? 128 : 30; }

  public boolean isAtLeast(int major, int minor) {
    return this.major > major || (this.major == major && this.minor >= minor);
  }

  @Override
  public int compareTo(OracleVersion o) {
    int c = Integer.compare(major, o.major);
    return c != 0 ? c : Integer.compare(minor, o.minor);
  }

  @Override
  public String toString() { return major + "." + minor; }
}
