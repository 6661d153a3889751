package com.gruelbox.schemamigrator.cli;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.gruelbox.schemamigrator.MigrationException;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point. Exits with 0 on success, 1 if the command failed and 2 if the command
 * line or configuration was wrong.
 */
@Slf4j
public final class SchemaMigratorCli {

  static final int SUCCESS = 0;
  static final int FAILURE = 1;
  static final int USAGE = 2;

  private static final String CONFIG_OPTION = "--config=";

  private final Map<String, Command> commands = new LinkedHashMap<>();

  public SchemaMigratorCli() {
    commands.put("migration:migrate", new MigrateCommand());
    commands.put("migration:rollback", new RollbackCommand());
    commands.put("migration:refresh", new RefreshCommand());
    commands.put("migration:fresh", new FreshCommand());
    commands.put("migration:squash", new SquashCommand());
    commands.put("show:migrations", new ShowMigrationsCommand());
    commands.put("make:migration", new MakeMigrationCommand());
    commands.put("show:backups", new ShowBackupsCommand());
    commands.put("cleanup:backups", new CleanupBackupsCommand());
    commands.put("restore:backup", new RestoreBackupCommand());
    commands.put("help", new HelpCommand(Collections.unmodifiableMap(commands)));
  }

  public static void main(String[] args) {
    int exitCode =
        new SchemaMigratorCli().run(args, System.in, System.out, System.err, System.getenv());
    System.exit(exitCode);
  }

  /**
   * Runs one command.
   *
   * @param args The command name followed by its arguments. {@code --config=FILE} may appear
   *     anywhere.
   * @param in Answers to interactive questions.
   * @param out Command output.
   * @param err Error messages.
   * @param env The environment, for configuration overrides.
   * @return The exit code.
   */
  public int run(
      String[] args, InputStream in, PrintStream out, PrintStream err, Map<String, String> env) {
    String name = "help";
    try {
      Path configFile = null;
      List<String> remaining = new ArrayList<>();
      for (String arg : Arrays.asList(args)) {
        if (arg.startsWith(CONFIG_OPTION)) {
          String value = arg.substring(CONFIG_OPTION.length());
          if (value.isEmpty()) {
            throw new UsageException("--config needs a file: --config=<FILE>");
          }
          configFile = Path.of(value);
        } else {
          remaining.add(arg);
        }
      }
      if (!remaining.isEmpty()) {
        name = remaining.get(0);
      }
      Command command = commands.get(name);
      if (command == null) {
        throw new UsageException("Unknown command '" + name + "'");
      }
      List<String> arguments =
          remaining.isEmpty() ? List.of() : remaining.subList(1, remaining.size());
      CommandLine line = CommandLine.parse(name, arguments);
      line.check(command.options(), command.maxArguments());
      CliConfiguration configuration = CliConfiguration.load(configFile, env);
      log.debug("Running {} with {}", name, configuration);
      try (CliContext context =
          new CliContext(
              configuration, new BufferedReader(new InputStreamReader(in, UTF_8)), out)) {
        command.execute(line, context);
      }
      return SUCCESS;
    } catch (UsageException e) {
      err.println("Error: " + e.getMessage());
      err.println("Run 'help' to see the available commands");
      return USAGE;
    } catch (MigrationException e) {
      log.debug("{} failed", name, e);
      err.println(name + " failed: " + e.getMessage());
      return FAILURE;
    } catch (RuntimeException e) {
      log.error("{} failed", name, e);
      err.println(name + " failed: " + e.getMessage());
      return FAILURE;
    }
  }
}
