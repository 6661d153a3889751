package com.gruelbox.schemamigrator.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;

/**
 * The arguments following a command name. {@code --name=value} and {@code --flag} are options,
 * anything else is positional.
 */
final class CommandLine {

  private static final Pattern POSITIVE_INT = Pattern.compile("0*[1-9][0-9]{0,8}");
  private static final Pattern NON_NEGATIVE_INT = Pattern.compile("0*[0-9]{1,9}");

  @Getter private final String command;
  private final Map<String, String> options;
  @Getter private final List<String> positional;

  private CommandLine(String command, Map<String, String> options, List<String> positional) {
    this.command = command;
    this.options = Collections.unmodifiableMap(options);
    this.positional = List.copyOf(positional);
  }

  static CommandLine parse(String command, List<String> args) {
    Map<String, String> options = new LinkedHashMap<>();
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      if (arg.startsWith("--") && arg.length() > 2) {
        int equals = arg.indexOf('=');
        String name = equals < 0 ? arg.substring(2) : arg.substring(2, equals);
        String value = equals < 0 ? "" : arg.substring(equals + 1);
        if (options.put(name, value) != null) {
          throw new UsageException("Option --" + name + " given more than once");
        }
      } else {
        positional.add(arg);
      }
    }
    return new CommandLine(command, options, positional);
  }

  /**
   * @param allowed The options the command understands.
   * @param maxPositional The most positional arguments the command accepts.
   */
  void check(Set<String> allowed, int maxPositional) {
    for (String name : options.keySet()) {
      if (!allowed.contains(name)) {
        throw new UsageException("Unknown option --" + name + " for " + command);
      }
    }
    if (positional.size() > maxPositional) {
      throw new UsageException("Unexpected argument '" + positional.get(maxPositional) + "'");
    }
  }

  boolean flag(String name) {
    String value = options.get(name);
    if (value == null) {
      return false;
    }
    if (!value.isEmpty()) {
      throw new UsageException("Option --" + name + " does not take a value");
    }
    return true;
  }

  Optional<String> option(String name) {
    String value = options.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (value.isEmpty()) {
      throw new UsageException("Option --" + name + " needs a value: --" + name + "=<value>");
    }
    return Optional.of(value);
  }

  Optional<Integer> positiveInt(String name) {
    return wholeNumber(name, POSITIVE_INT, "a positive");
  }

  Optional<Integer> nonNegativeInt(String name) {
    return wholeNumber(name, NON_NEGATIVE_INT, "zero or a positive");
  }

  private Optional<Integer> wholeNumber(String name, Pattern pattern, String kind) {
    return option(name)
        .map(
            value -> {
              if (!pattern.matcher(value).matches()) {
                throw new UsageException(
                    "Option --" + name + " must be " + kind + " whole number but was '" + value
                        + "'");
              }
              return Integer.parseInt(value);
            });
  }

  Optional<String> argument(int index) {
    return index < positional.size() ? Optional.of(positional.get(index)) : Optional.empty();
  }
}
