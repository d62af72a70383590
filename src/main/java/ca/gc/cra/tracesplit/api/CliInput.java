package ca.gc.cra.tracesplit.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments partitioned into recognised flags, unknown flags, and {@code key=value} tokens.
 *
 * <p>Any token starting with {@code '-'} and holding no {@code '='} is a flag. Every other token, including a bare
 * command name, is passed on for {@code key=value} parsing.</p>
 */
public final class CliInput {

  /** Flags understood by the tracesplit commands. */
  public enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run"),
    ALLOW_OVERWRITE("--allow-overwrite");

    private final Set<String> spellings;

    Flag(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Flag lookup(String lowerCaseToken) {
      for (Flag flag : values()) {
        if (flag.spellings.contains(lowerCaseToken)) {
          return flag;
        }
      }
      return null;
    }
  }

  private final List<String> keyValueArgs;
  private final Set<Flag> flags;
  private final Set<String> unknownFlags;

  private CliInput(List<String> keyValueArgs, Set<Flag> flags, Set<String> unknownFlags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
    this.unknownFlags = Set.copyOf(unknownFlags);
  }

  /**
   * Parses raw arguments; {@code null} and blank tokens are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    Set<String> unknown = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        Flag flag = Flag.lookup(lower);
        if (flag != null) {
          flags.add(flag);
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags, unknown);
  }

  /**
   * Returns the tokens left for {@code key=value} parsing.
   *
   * @return fresh array of non-flag tokens in argument order
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Checks whether a flag (or one of its aliases) was supplied.
   *
   * @param flag flag to query
   * @return {@code true} if present
   */
  public boolean has(Flag flag) {
    return flags.contains(flag);
  }

  public boolean help() {
    return has(Flag.HELP);
  }

  public boolean verbose() {
    return has(Flag.VERBOSE);
  }

  /**
   * Returns dash-prefixed tokens that match no known flag, lower-cased.
   *
   * @return unknown flags in argument order
   */
  public Set<String> unknownFlags() {
    return unknownFlags;
  }
}
