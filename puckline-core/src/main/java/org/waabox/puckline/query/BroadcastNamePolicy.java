package org.waabox.puckline.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides which broadcast networks are displayed for a game, in which
 * order, and under which names.
 *
 * <p>Raw names are first filtered and ordered by the preferred list, then
 * renamed: the first matching pattern wins, otherwise the exact-name map
 * applies, otherwise the raw name is kept. Duplicates are removed keeping
 * the first occurrence.
 *
 * <p>A preferred entry or pattern containing {@code *} or {@code ?} is a
 * case-insensitive wildcard; any other entry matches the name itself or
 * any name starting with it, so "FDSN" matches "FDSN1".
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BroadcastNamePolicy {

  /** The policy that keeps every name as is. */
  private static final BroadcastNamePolicy PASS_THROUGH =
      new BroadcastNamePolicy(List.of(), Map.of(), Map.of());

  /** The preferred names, in display order. */
  private final List<String> preferred;

  /** Wildcard or prefix patterns to display names, in match order. */
  private final Map<String, String> patterns;

  /** Exact raw names to display names. */
  private final Map<String, String> names;

  /**
   * Creates a new policy.
   *
   * @param thePreferred the preferred names, in display order, never null;
   *                     empty keeps every name
   * @param thePatterns  the patterns to display names, iterated in the
   *                     map's order, never null
   * @param theNames     the exact names to display names, never null
   */
  public BroadcastNamePolicy(final List<String> thePreferred,
      final Map<String, String> thePatterns,
      final Map<String, String> theNames) {
    preferred = List.copyOf(Objects.requireNonNull(thePreferred,
        "preferred must not be null"));
    patterns = new LinkedHashMap<>(Objects.requireNonNull(thePatterns,
        "patterns must not be null"));
    names = Map.copyOf(Objects.requireNonNull(theNames,
        "names must not be null"));
  }

  /**
   * Returns the policy used by the ticker for the Minnesota market.
   *
   * @return the default policy, never null
   */
  public static BroadcastNamePolicy defaults() {
    final Map<String, String> patterns = new LinkedHashMap<>();
    patterns.put("FDS*", "FanDuel Sports North");
    return new BroadcastNamePolicy(
        List.of("TNT", "TruTV", "ESPN*", "FDSN*", "FDS*", "Prime*",
            "ESPN Select"),
        patterns,
        Map.of("ESPN Select", "ESPN+", "ESPN", "ESPN", "TNT", "TNT",
            "TruTV", "TruTV", "Prime", "Prime Video"));
  }

  /**
   * Returns the policy that displays every raw name unchanged.
   *
   * @return the pass-through policy, never null
   */
  public static BroadcastNamePolicy passThrough() {
    return PASS_THROUGH;
  }

  /**
   * Builds the display list for the given raw network names.
   *
   * @param rawNames the names as sent upstream, never null
   *
   * @return the display names, never null
   */
  public List<String> apply(final List<String> rawNames) {
    Objects.requireNonNull(rawNames, "rawNames must not be null");
    final List<String> cleaned = new ArrayList<>();
    for (final String raw : rawNames) {
      if (raw != null && !raw.isBlank()) {
        cleaned.add(raw.trim());
      }
    }
    if (cleaned.isEmpty()) {
      return List.of();
    }

    final LinkedHashSet<String> displayed = new LinkedHashSet<>();
    for (final String name : pick(cleaned)) {
      displayed.add(rename(name));
    }
    return List.copyOf(displayed);
  }

  /** Filters and orders names by the preferred list. */
  private List<String> pick(final List<String> cleaned) {
    if (preferred.isEmpty()) {
      return cleaned;
    }
    final List<String> picked = new ArrayList<>();
    for (final String pattern : preferred) {
      for (final String name : cleaned) {
        if (matches(pattern, name)) {
          picked.add(name);
        }
      }
    }
    return picked.isEmpty() ? cleaned : picked;
  }

  private String rename(final String name) {
    for (final Map.Entry<String, String> entry : patterns.entrySet()) {
      if (matches(entry.getKey(), name)) {
        return entry.getValue();
      }
    }
    return names.getOrDefault(name, name);
  }

  /**
   * Matches a name against a wildcard pattern or a plain prefix, ignoring
   * case.
   *
   * @param pattern the pattern, may be null
   * @param name    the name, may be null
   *
   * @return true if the name matches
   */
  static boolean matches(final String pattern, final String name) {
    if (pattern == null || name == null || pattern.isBlank()
        || name.isBlank()) {
      return false;
    }
    final String p = pattern.trim().toLowerCase(Locale.ROOT);
    final String n = name.trim().toLowerCase(Locale.ROOT);
    if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
      return toRegex(p).matcher(n).matches();
    }
    return n.startsWith(p);
  }

  private static Pattern toRegex(final String glob) {
    final StringBuilder regex = new StringBuilder();
    final StringBuilder literal = new StringBuilder();
    for (final char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
