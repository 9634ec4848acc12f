package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import io.jenkins.infra.repository_rulesets_updater.BranchFilter;
import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to list the branches owned by teams, i.e. named {@code <team>-...}.
 */
@Command(
        name = "list-branches",
        description = "List the branches of repositories that belong to teams",
        mixinStandardHelpOptions = true)
public class ListBranchesCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-t", "--team"},
            split = ",",
            description = "Team whose branches to list (default: the configured teams); '" + BranchFilter.ALL_TEAMS
                    + "' lists all branches")
    private List<String> teams = new ArrayList<>();

    @Parameters(split = ",", arity = "0..*", description = "Repositories (default: all)")
    private List<String> repositories = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        Map<String, List<String>> branches =
                parent.updater("list-branches", false).listBranches(repositories, teams);
        for (Map.Entry<String, List<String>> entry : branches.entrySet()) {
            for (String branch : entry.getValue()) {
                out.println(entry.getKey() + " " + branch);
            }
        }
        out.flush();
        return 0;
    }
}
