package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import io.jenkins.infra.repository_rulesets_updater.cli.RulesetsUpdaterCLI;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetReconciler;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command to write rule set documents, as printed by {@code get-rules}, back to GitHub.
 */
@Command(
        name = "set-repo-rules",
        description = "Create or update rule sets from documents written by get-rules",
        mixinStandardHelpOptions = true)
public class SetRepoRulesCommand implements Callable<Integer> {

    @ParentCommand
    private RulesetsUpdaterCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Rule set documents")
    private List<Path> files;

    @Override
    public Integer call() throws Exception {
        RulesetReconciler.Result result =
                parent.updater("set-repo-rules", true).setRepositoryRulesets(files);
        spec.commandLine().getOut().println(result);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
