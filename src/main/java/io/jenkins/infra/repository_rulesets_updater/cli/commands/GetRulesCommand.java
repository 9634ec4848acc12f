package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import io.jenkins.infra.repository_rulesets_updater.RulesetsUpdater;
import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import java.io.BufferedWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to print the rule sets of repositories. The output can be edited and passed to {@code set-repo-rules}.
 */
@Command(name = "get-rules", description = "Print the rule sets of repositories", mixinStandardHelpOptions = true)
public class GetRulesCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--map-actors", description = "Add the names of Team bypass actors")
    private boolean mapActors;

    @Option(names = "--verbose", description = "Add timestamps and links")
    private boolean verbose;

    @Option(
            names = {"-o", "--output"},
            description = "Write to this file instead of standard output")
    private Path output;

    @Parameters(split = ",", arity = "0..*", description = "Repositories (default: all)")
    private List<String> repositories = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        if (output != null) {
            String problem = checkWritable(output);
            if (problem != null) {
                throw new ParameterException(spec.commandLine(), "Cannot write " + output + ": " + problem);
            }
        }
        RulesetsUpdater updater = parent.updater("get-rules", false);
        List<JsonObject> rulesets = updater.getRulesets(repositories);
        if (output != null) {
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                updater.writeRulesets(rulesets, mapActors, verbose, writer);
            }
        } else {
            PrintWriter out = spec.commandLine().getOut();
            updater.writeRulesets(rulesets, mapActors, verbose, out);
            out.flush();
        }
        return 0;
    }

    /**
     * Checks an output file before any work is done: it must be a writable file, or not exist yet in a writable
     * directory.
     *
     * @return the problem, or {@code null} if the file can be written
     */
    @CheckForNull
    static String checkWritable(Path file) {
        if (Files.exists(file)) {
            if (!Files.isRegularFile(file)) {
                return "not a regular file";
            }
            return Files.isWritable(file) ? null : "file is not writable";
        }
        Path directory = file.toAbsolutePath().getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return "directory does not exist";
        }
        return Files.isWritable(directory) ? null : "directory is not writable";
    }
}
