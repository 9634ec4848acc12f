package io.jenkins.infra.repository_rulesets_updater.rulesets;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.github.GitHubClient;
import io.jenkins.infra.repository_rulesets_updater.github.PageFolder;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link RulesetService} backed by the GitHub REST API.
 *
 * @link https://docs.github.com/en/rest/repos/rules
 */
public class GitHubRulesetService implements RulesetService {

    private final GitHubClient client;
    private final PageFolder folder;
    private final String organization;

    public GitHubRulesetService(
            @NonNull GitHubClient client, @NonNull PageFolder folder, @NonNull String organization) {
        this.client = client;
        this.folder = folder;
        this.organization = organization;
    }

    @Override
    public List<JsonObject> listRulesetSummaries(String repository) throws IOException {
        return folder.fold(
                rulesetsPath(repository),
                (List<JsonObject> acc, JsonObject summary) -> {
                    acc.add(summary);
                    return acc;
                },
                new ArrayList<>(),
                Map.of());
    }

    @Override
    public JsonObject getRuleset(String repository, long id) throws IOException {
        JsonElement ruleset = client.get(rulesetsPath(repository) + "/" + id);
        if (!ruleset.isJsonObject()) {
            throw new IOException("Unexpected rule set " + id + " of " + repository + ": " + ruleset);
        }
        return ruleset.getAsJsonObject();
    }

    @Override
    public JsonObject createRuleset(String repository, JsonObject payload) throws IOException {
        return client.post(rulesetsPath(repository), payload);
    }

    @Override
    public JsonObject updateRuleset(String repository, long id, JsonObject payload) throws IOException {
        return client.put(rulesetsPath(repository) + "/" + id, payload);
    }

    private String rulesetsPath(String repository) {
        return "/repos/" + organization + "/" + repository + "/rulesets";
    }
}
