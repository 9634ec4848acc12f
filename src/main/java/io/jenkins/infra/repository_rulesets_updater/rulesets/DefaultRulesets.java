package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetFields.*;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.MalformedRulesetException;
import io.jenkins.infra.repository_rulesets_updater.github.TeamLookup;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the rule set template pushed by {@code set-default-rules}.
 */
public final class DefaultRulesets {

    static final String RESOURCE = "/default-rulesets.yml";

    private static final Gson GSON = new Gson();

    /**
     * @param file a YAML list of rule sets, or {@code null} for the bundled template
     * @return the rule sets, team bypass actors possibly still referenced by {@code actor_name}
     */
    @NonNull
    public static List<JsonObject> load(@CheckForNull Path file) throws IOException {
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return parse(reader, file.toString());
            }
        }
        InputStream stream = DefaultRulesets.class.getResourceAsStream(RESOURCE);
        if (stream == null) {
            throw new IOException("Missing resource " + RESOURCE);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return parse(reader, RESOURCE);
        }
    }

    static List<JsonObject> parse(Reader reader, String source) throws IOException {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Failed to read " + source, e);
        }
        JsonElement tree = GSON.toJsonTree(document);
        if (!tree.isJsonArray()) {
            throw new MalformedRulesetException(source + " must contain a list of rule sets");
        }
        List<JsonObject> rulesets = new ArrayList<>();
        for (JsonElement element : tree.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new MalformedRulesetException(source + " contains a rule set that is not a mapping: " + element);
            }
            rulesets.add(element.getAsJsonObject());
        }
        return rulesets;
    }

    /**
     * Adds each team as {@code always} bypass actor, referenced by name, to every rule set not already listing it,
     * either by name or by id.
     *
     * @param lookup resolves the teams' ids
     * @return new rule sets, the arguments are not modified
     * @throws io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException if a team is unknown
     */
    @NonNull
    public static List<JsonObject> withBypassTeams(
            @NonNull List<JsonObject> rulesets, @NonNull List<String> teams, @NonNull TeamLookup lookup)
            throws IOException {
        Map<String, Long> ids = new LinkedHashMap<>();
        for (String team : teams) {
            ids.put(team, lookup.teamId(team));
        }
        List<JsonObject> result = new ArrayList<>();
        for (JsonObject ruleset : rulesets) {
            JsonObject copy = ruleset.deepCopy();
            JsonArray actors = copy.has(BYPASS_ACTORS) && copy.get(BYPASS_ACTORS).isJsonArray()
                    ? copy.getAsJsonArray(BYPASS_ACTORS)
                    : new JsonArray();
            for (Map.Entry<String, Long> team : ids.entrySet()) {
                if (!listsTeam(actors, team.getKey(), team.getValue())) {
                    JsonObject actor = new JsonObject();
                    actor.addProperty(ACTOR_TYPE, ACTOR_TYPE_TEAM);
                    actor.addProperty(ACTOR_NAME, team.getKey());
                    actor.addProperty(BYPASS_MODE, "always");
                    actors.add(actor);
                }
            }
            copy.add(BYPASS_ACTORS, actors);
            result.add(copy);
        }
        return result;
    }

    private static boolean listsTeam(JsonArray actors, String team, long id) {
        for (JsonElement element : actors) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject actor = element.getAsJsonObject();
            if (!isPrimitive(actor, ACTOR_TYPE) || !ACTOR_TYPE_TEAM.equals(actor.get(ACTOR_TYPE).getAsString())) {
                continue;
            }
            if (isPrimitive(actor, ACTOR_NAME) && team.equals(actor.get(ACTOR_NAME).getAsString())) {
                return true;
            }
            if (isPrimitive(actor, ACTOR_ID)
                    && actor.getAsJsonPrimitive(ACTOR_ID).isNumber()
                    && actor.get(ACTOR_ID).getAsLong() == id) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPrimitive(JsonObject json, String key) {
        JsonElement value = json.get(key);
        return value != null && value.isJsonPrimitive();
    }

    private DefaultRulesets() {
        /* prevent instantiation */
    }
}
