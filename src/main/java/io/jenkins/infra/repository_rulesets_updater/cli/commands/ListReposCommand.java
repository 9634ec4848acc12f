package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to list the repositories of the organization.
 */
@Command(name = "list-repos", description = "List the repositories of the organization", mixinStandardHelpOptions = true)
public class ListReposCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        for (String repository : parent.updater("list-repos", false).listRepositories()) {
            out.println(repository);
        }
        out.flush();
        return 0;
    }
}
