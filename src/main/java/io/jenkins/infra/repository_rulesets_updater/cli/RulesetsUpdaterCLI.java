package io.jenkins.infra.repository_rulesets_updater.cli;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import io.jenkins.infra.repository_rulesets_updater.CommandException;
import io.jenkins.infra.repository_rulesets_updater.Configuration;
import io.jenkins.infra.repository_rulesets_updater.RulesetsUpdater;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.GetRulesCommand;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.ListBranchesCommand;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.ListReposCommand;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.ListTeamsCommand;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.SetDefaultRulesCommand;
import io.jenkins.infra.repository_rulesets_updater.cli.commands.SetRepoRulesCommand;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for the Repository Rulesets Updater CLI.
 * Each subcommand is one operation against the configured organization.
 */
@Command(
        name = "rulesets-cli",
        description = "Repository Rulesets Updater - List and update GitHub repository rule sets",
        mixinStandardHelpOptions = true,
        version = "1.0-SNAPSHOT",
        subcommands = {
            ListReposCommand.class,
            ListTeamsCommand.class,
            ListBranchesCommand.class,
            GetRulesCommand.class,
            SetDefaultRulesCommand.class,
            SetRepoRulesCommand.class
        })
public class RulesetsUpdaterCLI implements Runnable {

    static final String LOG_FILE = "rulesets-cli.log";

    @Option(
            names = {"-c", "--config"},
            description = "Configuration file (default: ./rulesets-updater.yml if it exists)")
    private Path config;

    @Option(names = "--debug", description = "Print stack traces on error")
    boolean debug;

    @Option(
            names = "--log-level",
            defaultValue = "INFO",
            description = "ALL, DEBUG, INFO, WARNING, ERROR or NONE (default: ${DEFAULT-VALUE})")
    private String logLevel;

    @Option(names = "--log-dir", description = "Also append log messages to " + LOG_FILE + " in this directory")
    private Path logDir;

    public static void main(String[] args) {
        System.exit(commandLine(new RulesetsUpdaterCLI()).execute(args));
    }

    static CommandLine commandLine(RulesetsUpdaterCLI cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            PrintWriter err = cmd.getErr();
            err.println("ERROR: " + (ex.getMessage() != null ? ex.getMessage() : ex));
            if (cli.debug) {
                ex.printStackTrace(err);
            }
            err.flush();
            return 1;
        });
        return commandLine;
    }

    @Override
    public void run() {
        // When no subcommand is specified, show usage
        CommandLine.usage(this, System.out);
    }

    /**
     * Loads the configuration and connects to GitHub.
     *
     * @param writes whether the command modifies rule sets
     * @throws CommandException if the command writes and the configuration is read-only
     */
    public RulesetsUpdater updater(String command, boolean writes) throws IOException {
        configureLogging(logLevel, logDir);
        Configuration configuration = loadConfiguration();
        if (writes && configuration.isReadOnly()) {
            throw new CommandException("Command " + command + " is not allowed, the configuration is read-only");
        }
        return RulesetsUpdater.create(configuration);
    }

    Configuration loadConfiguration() throws IOException {
        if (config != null) {
            return Configuration.load(config);
        }
        return Configuration.load(Files.exists(Configuration.DEFAULT_FILE) ? Configuration.DEFAULT_FILE : null);
    }

    /**
     * Resets logging to the console configuration of {@code logging.properties}.
     *
     * @param level the root level
     * @param logDir if not {@code null}, the directory of the log file, created if missing
     */
    static void configureLogging(String level, @CheckForNull Path logDir) throws IOException {
        Level rootLevel = toLevel(level);
        try (InputStream is = RulesetsUpdaterCLI.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        }
        Logger root = Logger.getLogger("");
        root.setLevel(rootLevel);
        if (logDir != null) {
            root.addHandler(logFileHandler(logDir));
        }
    }

    static FileHandler logFileHandler(Path logDir) throws IOException {
        Files.createDirectories(logDir);
        if (!Files.isWritable(logDir)) {
            throw new IOException("Log directory is not writable: " + logDir);
        }
        FileHandler handler = new FileHandler(logDir.resolve(LOG_FILE).toString(), true);
        handler.setEncoding(StandardCharsets.UTF_8.name());
        handler.setFormatter(new LogFileFormatter());
        return handler;
    }

    static Level toLevel(String name) {
        switch (name.toUpperCase(Locale.ROOT)) {
            case "DEBUG":
                return Level.FINE;
            case "ERROR":
                return Level.SEVERE;
            case "NONE":
                return Level.OFF;
            default:
                return Level.parse(name.toUpperCase(Locale.ROOT));
        }
    }
}
