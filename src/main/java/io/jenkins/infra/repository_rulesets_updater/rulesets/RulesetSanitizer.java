package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetFields.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.MalformedRulesetException;
import io.jenkins.infra.repository_rulesets_updater.github.TeamLookup;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns a rule set record, as read from GitHub or from a document written by {@link RulesetEmitter}, back into a
 * record that may be written to GitHub.
 */
public class RulesetSanitizer {
    private static final Logger LOGGER = Logger.getLogger(RulesetSanitizer.class.getName());

    private final TeamLookup teams;

    public RulesetSanitizer(@NonNull TeamLookup teams) {
        this.teams = teams;
    }

    /**
     * Copies the known keys of {@code raw} into a new record, drops everything else (timestamps, links, ...),
     * resolves {@code actor_name} of Team bypass actors to {@code actor_id} and removes all {@code actor_name}.
     * The argument is not modified.
     *
     * @throws MalformedRulesetException if a required key is missing or a bypass actor has no id
     * @throws io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException if a team name is unknown
     */
    @NonNull
    public JsonObject sanitize(@NonNull JsonObject raw) throws IOException {
        JsonObject clean = new JsonObject();
        for (String key : KEYS) {
            JsonElement value = raw.get(key);
            if (value != null) {
                clean.add(key, value.deepCopy());
            }
        }

        List<String> missing =
                WRITE_KEYS.stream().filter(key -> !clean.has(key)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new MalformedRulesetException("Rule set " + describe(raw) + " is missing " + String.join(", ", missing));
        }

        JsonElement actors = clean.get(BYPASS_ACTORS);
        if (!actors.isJsonArray()) {
            throw new MalformedRulesetException("Rule set " + describe(raw) + ": " + BYPASS_ACTORS + " is not a list");
        }
        JsonArray resolved = new JsonArray();
        for (JsonElement actor : actors.getAsJsonArray()) {
            if (!actor.isJsonObject()) {
                throw new MalformedRulesetException("Rule set " + describe(raw) + ": invalid bypass actor " + actor);
            }
            resolved.add(sanitizeActor(raw, actor.getAsJsonObject()));
        }
        clean.add(BYPASS_ACTORS, resolved);
        return clean;
    }

    private JsonObject sanitizeActor(JsonObject ruleset, JsonObject actor) throws IOException {
        String type = optionalString(ruleset, actor, ACTOR_TYPE);
        String name = optionalString(ruleset, actor, ACTOR_NAME);
        if (!hasValue(actor, ACTOR_ID) && name != null) {
            if (!ACTOR_TYPE_TEAM.equals(type)) {
                throw new MalformedRulesetException("Rule set " + describe(ruleset)
                        + ": only Team bypass actors can be referenced by name, got " + actor);
            }
            long id = teams.teamId(name);
            LOGGER.log(Level.FINE, "Resolved team {0} to {1}", new Object[] {name, id});
            actor.addProperty(ACTOR_ID, id);
        }
        actor.remove(ACTOR_NAME);
        if (hasValue(actor, ACTOR_ID)
                && !(actor.get(ACTOR_ID).isJsonPrimitive()
                        && actor.getAsJsonPrimitive(ACTOR_ID).isNumber())) {
            throw new MalformedRulesetException(
                    "Rule set " + describe(ruleset) + ": bypass actor id is not a number in " + actor);
        }
        // deploy keys are the only actors GitHub identifies without id
        if (!hasValue(actor, ACTOR_ID) && !ACTOR_TYPE_DEPLOY_KEY.equals(type)) {
            throw new MalformedRulesetException("Rule set " + describe(ruleset) + ": bypass actor without id " + actor);
        }
        return actor;
    }

    /**
     * @return the string value of {@code key}, or {@code null} if it is absent or JSON {@code null}
     * @throws MalformedRulesetException if the value is an object or a list
     */
    @CheckForNull
    private static String optionalString(JsonObject ruleset, JsonObject actor, String key) {
        JsonElement value = actor.get(key);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new MalformedRulesetException(
                    "Rule set " + describe(ruleset) + ": bypass actor " + key + " is not a string in " + actor);
        }
        return value.getAsString();
    }

    private static boolean hasValue(JsonObject json, String key) {
        return json.has(key) && !json.get(key).isJsonNull();
    }

    static String describe(JsonObject ruleset) {
        JsonElement name = ruleset.get(NAME);
        return name != null && name.isJsonPrimitive() ? "'" + name.getAsString() + "'" : "<unnamed>";
    }
}
