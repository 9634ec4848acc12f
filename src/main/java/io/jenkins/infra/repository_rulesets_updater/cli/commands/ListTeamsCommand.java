package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to list the teams of the organization, or the configured subset of them.
 */
@Command(name = "list-teams", description = "List the teams of the organization", mixinStandardHelpOptions = true)
public class ListTeamsCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--ids", description = "Print the team ids as well")
    private boolean ids;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        for (Map.Entry<String, Long> team :
                parent.updater("list-teams", false).listTeams().entrySet()) {
            out.println(ids ? team.getKey() + " " + team.getValue() : team.getKey());
        }
        out.flush();
        return 0;
    }
}
