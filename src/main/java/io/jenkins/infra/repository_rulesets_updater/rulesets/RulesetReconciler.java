package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetFields.*;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.MalformedRulesetException;
import io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates or updates repository rule sets so that they match a desired state. Rule sets are matched by name, the id
 * assigned by GitHub is only used once a match was found.
 */
public class RulesetReconciler {
    private static final Logger LOGGER = Logger.getLogger(RulesetReconciler.class.getName());

    private final RulesetService service;
    private final String organization;

    public RulesetReconciler(@NonNull RulesetService service, @NonNull String organization) {
        this.service = service;
        this.organization = organization;
    }

    /**
     * Fetches the full rule sets of a repository: one pass over the summaries, then one request per rule set.
     *
     * @param repository the repository name, without organization
     * @param repositoryOnly whether to skip rule sets inherited from the organization
     */
    @NonNull
    public List<JsonObject> fetchRulesets(@NonNull String repository, boolean repositoryOnly) throws IOException {
        List<JsonObject> rulesets = new ArrayList<>();
        for (JsonObject summary : service.listRulesetSummaries(repository)) {
            if (repositoryOnly && !isRepositoryScoped(summary)) {
                LOGGER.log(Level.FINE, "Skipping inherited rule set {0} of {1}", new Object[] {
                    RulesetSanitizer.describe(summary), repository
                });
                continue;
            }
            rulesets.add(service.getRuleset(repository, summary.get(ID).getAsLong()));
        }
        return rulesets;
    }

    /**
     * Writes sanitized rule sets to the repositories named by their {@code source}. Each repository's existing rule
     * sets are fetched once; rule sets created along the way count as existing for the rest of the batch.
     * Rule sets whose {@code source_type} is not {@code Repository} are skipped.
     *
     * @throws MalformedRulesetException if a rule set has no {@code source} or {@code source_type}
     * @throws UnresolvedReferenceException if a {@code source} is not a repository of the configured organization
     */
    @NonNull
    public Result reconcile(@NonNull List<JsonObject> desired) throws IOException {
        Result result = new Result();
        Map<String, List<JsonObject>> byRepository = new LinkedHashMap<>();
        for (JsonObject ruleset : desired) {
            String sourceType = requiredString(ruleset, SOURCE_TYPE);
            if (!SOURCE_TYPE_REPOSITORY.equals(sourceType)) {
                LOGGER.log(Level.WARNING, "Skipping rule set {0} with source type {1}", new Object[] {
                    RulesetSanitizer.describe(ruleset), sourceType
                });
                result.skipped++;
                continue;
            }
            String repository = toRepository(requiredString(ruleset, SOURCE));
            byRepository.computeIfAbsent(repository, unused -> new ArrayList<>()).add(ruleset);
        }

        for (Map.Entry<String, List<JsonObject>> entry : byRepository.entrySet()) {
            String repository = entry.getKey();
            List<JsonObject> known = fetchRulesets(repository, true);
            Set<String> written = new HashSet<>();
            for (JsonObject ruleset : entry.getValue()) {
                String name = ruleset.get(NAME).getAsString();
                if (!written.add(name)) {
                    LOGGER.log(
                            Level.WARNING,
                            "Rule set ''{0}'' is written to {1} more than once, the last definition wins",
                            new Object[] {name, repository});
                }
                reconcileOne(repository, ruleset, known, result);
            }
        }
        LOGGER.log(Level.INFO, "Reconciled rule sets: {0}", result);
        return result;
    }

    /**
     * Writes the same rule sets to every repository. The existing rule sets are fetched again for each repository,
     * as the template's names are meant to exist in all of them.
     *
     * @param template sanitized rule sets without id
     * @param repositories repository names, without organization
     */
    @NonNull
    public Result reconcileDefaults(@NonNull List<JsonObject> template, @NonNull List<String> repositories)
            throws IOException {
        Result result = new Result();
        for (String repository : repositories) {
            List<JsonObject> known = fetchRulesets(repository, true);
            for (JsonObject ruleset : template) {
                JsonObject copy = ruleset.deepCopy();
                copy.remove(ID);
                reconcileOne(repository, copy, known, result);
            }
        }
        LOGGER.log(Level.INFO, "Reconciled default rule sets: {0}", result);
        return result;
    }

    private void reconcileOne(String repository, JsonObject ruleset, List<JsonObject> known, Result result)
            throws IOException {
        String name = ruleset.get(NAME).getAsString();
        JsonObject payload = writePayload(ruleset);

        Long id = optionalId(ruleset);
        if (id == null) {
            JsonObject match = findByName(known, name);
            if (match != null) {
                id = match.get(ID).getAsLong();
            }
        }

        if (id != null) {
            LOGGER.log(Level.INFO, "Updating rule set ''{0}'' ({1}) of {2}", new Object[] {name, id, repository});
            service.updateRuleset(repository, id, payload);
            result.updated++;
            return;
        }

        LOGGER.log(Level.INFO, "Creating rule set ''{0}'' in {1}", new Object[] {name, repository});
        JsonObject created = service.createRuleset(repository, payload);
        JsonObject merged = ruleset.deepCopy();
        for (String key : List.of(ID, SOURCE, SOURCE_TYPE)) {
            JsonElement value = created.get(key);
            if (value != null) {
                merged.add(key, value);
            }
        }
        if (!merged.has(ID)) {
            throw new IOException("GitHub did not return an id for rule set '" + name + "' in " + repository);
        }
        known.add(merged);
        result.created++;
    }

    /**
     * Maps a {@code source} of the form {@code organization/repository} to the repository name.
     *
     * @throws UnresolvedReferenceException if the source is malformed or belongs to another organization
     */
    @NonNull
    String toRepository(@NonNull String source) {
        String[] parts = source.split("/", -1);
        if (parts.length != 2 || parts[1].isEmpty() || !parts[0].equalsIgnoreCase(organization)) {
            throw new UnresolvedReferenceException(
                    "Rule set source '" + source + "' is not a repository of " + organization);
        }
        return parts[1];
    }

    static JsonObject writePayload(JsonObject ruleset) {
        JsonObject payload = new JsonObject();
        for (String key : WRITE_KEYS) {
            JsonElement value = ruleset.get(key);
            if (value != null) {
                payload.add(key, value.deepCopy());
            }
        }
        return payload;
    }

    @CheckForNull
    private static JsonObject findByName(List<JsonObject> rulesets, String name) {
        for (JsonObject ruleset : rulesets) {
            JsonElement other = ruleset.get(NAME);
            if (other != null && name.equals(other.getAsString())) {
                return ruleset;
            }
        }
        return null;
    }

    @CheckForNull
    private static Long optionalId(JsonObject ruleset) {
        JsonElement id = ruleset.get(ID);
        return id == null || id.isJsonNull() ? null : id.getAsLong();
    }

    private static boolean isRepositoryScoped(JsonObject summary) {
        JsonElement sourceType = summary.get(SOURCE_TYPE);
        // without source type the rule set is taken to belong to the repository
        return sourceType == null || SOURCE_TYPE_REPOSITORY.equals(sourceType.getAsString());
    }

    private static String requiredString(JsonObject ruleset, String key) {
        JsonElement value = ruleset.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            throw new MalformedRulesetException("Rule set " + RulesetSanitizer.describe(ruleset) + " has no " + key);
        }
        return value.getAsString();
    }

    /**
     * Counts the writes issued by a reconciliation.
     */
    public static final class Result {
        private int created;
        private int updated;
        private int skipped;

        public int getCreated() {
            return created;
        }

        public int getUpdated() {
            return updated;
        }

        public int getSkipped() {
            return skipped;
        }

        @Override
        public String toString() {
            return created + " created, " + updated + " updated, " + skipped + " skipped";
        }
    }
}
