package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetReconciler;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to create or update the default rule sets in repositories.
 */
@Command(
        name = "set-default-rules",
        description = "Create or update the default rule sets of repositories",
        mixinStandardHelpOptions = true)
public class SetDefaultRulesCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(split = ",", arity = "1..*", description = "Repositories")
    private List<String> repositories;

    @Override
    public Integer call() throws Exception {
        RulesetReconciler.Result result =
                parent.updater("set-default-rules", true).setDefaultRulesets(repositories);
        spec.commandLine().getOut().println(result);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
