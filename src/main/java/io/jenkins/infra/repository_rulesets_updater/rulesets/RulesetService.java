package io.jenkins.infra.repository_rulesets_updater.rulesets;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.util.List;

/**
 * Repository rule set endpoints of one organization.
 */
public interface RulesetService {

    /**
     * @param repository the repository name, without organization
     * @return the rule set summaries of every page, in server order
     */
    List<JsonObject> listRulesetSummaries(String repository) throws IOException;

    /**
     * @return the full rule set
     */
    JsonObject getRuleset(String repository, long id) throws IOException;

    /**
     * @return the created rule set, including its assigned id
     */
    JsonObject createRuleset(String repository, JsonObject payload) throws IOException;

    /**
     * @return the updated rule set
     */
    JsonObject updateRuleset(String repository, long id, JsonObject payload) throws IOException;
}
