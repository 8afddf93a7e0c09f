package ca.gc.cra.fragmenter.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments of the fragment commands, split into recognised switches and {@code key=value}
 * settings.
 *
 * <p>A token starting with {@code -} and carrying no {@code =} is a switch. The recognised switches are
 * help ({@code --help}, {@code -h}, {@code help}), verbose logging ({@code --verbose}, {@code -v},
 * {@code --debug}), {@code --dry-run} and {@code --allow-overwrite}; anything else is kept in
 * {@link #unknownFlags()} so the command can reject it. All other tokens go on to {@code key=value}
 * parsing.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> DRY_RUN_FLAGS = Set.of("--dry-run", "--dryrun");
  private static final Set<String> ALLOW_OVERWRITE_FLAGS = Set.of("--allow-overwrite", "--overwrite");
  private static final CliInput EMPTY = new CliInput(new String[0], false, false, false, false, Set.of());

  private final String[] keyValueArgs;
  private final boolean help;
  private final boolean verbose;
  private final boolean dryRun;
  private final boolean allowOverwrite;
  private final Set<String> unknownFlags;

  private CliInput(
      String[] keyValueArgs,
      boolean help,
      boolean verbose,
      boolean dryRun,
      boolean allowOverwrite,
      Set<String> unknownFlags) {
    this.keyValueArgs = keyValueArgs;
    this.help = help;
    this.verbose = verbose;
    this.dryRun = dryRun;
    this.allowOverwrite = allowOverwrite;
    this.unknownFlags = unknownFlags;
  }

  /**
   * Parses raw arguments. Blank tokens are dropped and switches match case-insensitively.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return EMPTY;
    }

    List<String> kv = new ArrayList<>();
    Set<String> unknown = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    boolean allowOverwrite = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (DRY_RUN_FLAGS.contains(lower)) {
        dryRun = true;
      } else if (ALLOW_OVERWRITE_FLAGS.contains(lower)) {
        allowOverwrite = true;
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        unknown.add(arg);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(
        kv.toArray(String[]::new), help, verbose, dryRun, allowOverwrite, Set.copyOf(unknown));
  }

  /**
   * Returns a copy of the key/value style arguments.
   *
   * @return arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return help;
  }

  /** @return {@code true} when {@code --verbose} (or an alias) was present */
  public boolean verbose() {
    return verbose;
  }

  /** @return {@code true} when {@code --dry-run} was present */
  public boolean dryRun() {
    return dryRun;
  }

  /** @return {@code true} when {@code --allow-overwrite} was present */
  public boolean allowOverwrite() {
    return allowOverwrite;
  }

  /**
   * Returns switches that are not recognised, as typed.
   *
   * @return unrecognised switches; empty when every switch is known
   */
  public Set<String> unknownFlags() {
    return unknownFlags;
  }
}
