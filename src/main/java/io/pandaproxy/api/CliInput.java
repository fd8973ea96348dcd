package io.pandaproxy.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tokenized {@code pandaproxy} command line.
 * <p>The grammar is {@code [command] (switch | key=value)*}. A leading bare word names the
 * command; switches start with {@code -}; everything else is handed to {@link CliArgsParser}.
 * Blank tokens are ignored.</p>
 *
 * @param command leading bare word, lower-cased, or {@code null} when the line starts with a
 *     switch or a setting
 * @param switches recognised switches
 * @param settings {@code key=value} tokens in order, plus any stray bare words for the parser to
 *     reject
 * @param afterCommand trimmed tokens following the command, switches included, for delegation
 */
public record CliInput(String command, Set<Switch> switches, List<String> settings, List<String> afterCommand) {

  /** Switches understood by every command. */
  public enum Switch {
    HELP("--help", "-h"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run");

    private final Set<String> spellings;

    Switch(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Optional<Switch> lookup(String token) {
      String lower = token.toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(lower)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  public CliInput {
    switches = Set.copyOf(switches);
    settings = List.copyOf(settings);
    afterCommand = List.copyOf(afterCommand);
  }

  /**
   * @param args raw arguments; {@code null} is treated as empty
   * @return tokenized command line
   * @throws IllegalArgumentException on a switch no command understands
   */
  public static CliInput parse(String[] args) {
    List<String> tokens = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        if (raw != null && !raw.isBlank()) {
          tokens.add(raw.trim());
        }
      }
    }

    String command = null;
    int start = 0;
    if (!tokens.isEmpty() && isBareWord(tokens.get(0))) {
      command = tokens.get(0).toLowerCase(Locale.ROOT);
      start = 1;
    }

    EnumSet<Switch> switches = EnumSet.noneOf(Switch.class);
    List<String> settings = new ArrayList<>();
    for (String token : tokens.subList(start, tokens.size())) {
      if (token.startsWith("-") && token.indexOf('=') < 0) {
        switches.add(Switch.lookup(token)
            .orElseThrow(() -> new IllegalArgumentException("unknown option: " + token)));
      } else {
        settings.add(token);
      }
    }
    // "pandaproxy help" reads the same as "pandaproxy --help"
    if ("help".equals(command)) {
      switches.add(Switch.HELP);
    }
    return new CliInput(command, switches, settings, tokens.subList(start, tokens.size()));
  }

  private static boolean isBareWord(String token) {
    return !token.startsWith("-") && token.indexOf('=') < 0;
  }

  public boolean has(Switch flag) {
    return switches.contains(flag);
  }

  public boolean help() {
    return has(Switch.HELP);
  }

  public boolean verbose() {
    return has(Switch.VERBOSE);
  }

  /** @return true when the line carries neither a command, a switch nor a setting */
  public boolean isEmpty() {
    return command == null && switches.isEmpty() && settings.isEmpty();
  }

  /**
   * Settings to feed {@link CliArgsParser#toMap(String[])}. A command word is part of them when
   * the caller is already past dispatch.
   */
  public String[] settingArgs() {
    List<String> all = new ArrayList<>(settings.size() + 1);
    if (command != null && !"help".equals(command)) {
      all.add(command);
    }
    all.addAll(settings);
    return all.toArray(String[]::new);
  }
}
