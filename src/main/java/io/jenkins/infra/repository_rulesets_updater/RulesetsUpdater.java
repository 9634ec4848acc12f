package io.jenkins.infra.repository_rulesets_updater;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.github.GitHubClient;
import io.jenkins.infra.repository_rulesets_updater.github.OrganizationIndex;
import io.jenkins.infra.repository_rulesets_updater.github.PageFolder;
import io.jenkins.infra.repository_rulesets_updater.rulesets.DefaultRulesets;
import io.jenkins.infra.repository_rulesets_updater.rulesets.GitHubRulesetService;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetEmitter;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetReconciler;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetSanitizer;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetService;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The operations of the command line tool, run against one organization.
 */
public class RulesetsUpdater {
    private static final Logger LOGGER = Logger.getLogger(RulesetsUpdater.class.getName());

    private final Configuration config;
    private final PageFolder folder;
    private final OrganizationIndex index;
    private final RulesetSanitizer sanitizer;
    private final RulesetReconciler reconciler;

    RulesetsUpdater(
            @NonNull Configuration config,
            @NonNull PageFolder folder,
            @NonNull OrganizationIndex index,
            @NonNull RulesetService rulesets) {
        this.config = config;
        this.folder = folder;
        this.index = index;
        this.sanitizer = new RulesetSanitizer(index);
        this.reconciler = new RulesetReconciler(rulesets, config.getOrganization());
    }

    /**
     * Connects to GitHub with the token of the configured credentials file.
     */
    @NonNull
    public static RulesetsUpdater create(@NonNull Configuration config) throws IOException {
        String token = Credentials.loadToken(config.getCredentialsPath());
        GitHubClient client = new GitHubClient(config.getApiUrl(), token, config.getPageSize());
        PageFolder folder = new PageFolder(client);
        OrganizationIndex index = new OrganizationIndex(folder, config.getOrganization(), config.getTeams());
        return new RulesetsUpdater(
                config, folder, index, new GitHubRulesetService(client, folder, config.getOrganization()));
    }

    @NonNull
    public List<String> listRepositories() throws IOException {
        return index.repositories();
    }

    /**
     * @return the working set of teams with their ids, sorted by name unless restricted by configuration
     */
    @NonNull
    public Map<String, Long> listTeams() throws IOException {
        Map<String, Long> teams = new LinkedHashMap<>();
        for (String name : index.teamNames()) {
            teams.put(name, index.teamId(name));
        }
        return teams;
    }

    /**
     * @param repositories repository names, empty for all repositories
     * @param teams team names, empty for the working set of teams; {@link BranchFilter#ALL_TEAMS} for all branches
     * @return the selected branches of each repository
     */
    @NonNull
    public Map<String, List<String>> listBranches(@NonNull List<String> repositories, @NonNull List<String> teams)
            throws IOException {
        List<String> owners = teams.isEmpty() ? index.teamNames() : teams;
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String repository : resolveRepositories(repositories)) {
            List<String> branches =
                    folder.names("/repos/" + config.getOrganization() + "/" + repository + "/branches", Map.of());
            result.put(repository, BranchFilter.filter(branches, owners));
        }
        return result;
    }

    /**
     * @param repositories repository names, empty for all repositories
     * @return the full rule sets of the repositories, including the ones inherited from the organization
     */
    @NonNull
    public List<JsonObject> getRulesets(@NonNull List<String> repositories) throws IOException {
        List<JsonObject> rulesets = new ArrayList<>();
        for (String repository : resolveRepositories(repositories)) {
            rulesets.addAll(reconciler.fetchRulesets(repository, false));
        }
        return rulesets;
    }

    public void writeRulesets(
            @NonNull List<JsonObject> rulesets, boolean mapActors, boolean verbose, @NonNull Appendable out)
            throws IOException {
        new RulesetEmitter(config.getIndent(), verbose, mapActors ? index : null).emit(rulesets, out);
    }

    /**
     * Creates or updates the default rule sets in each repository.
     */
    @NonNull
    public RulesetReconciler.Result setDefaultRulesets(@NonNull List<String> repositories) throws IOException {
        if (repositories.isEmpty()) {
            throw new IllegalArgumentException("No repositories given");
        }
        List<String> targets = resolveRepositories(repositories);
        List<JsonObject> template = new ArrayList<>();
        for (JsonObject ruleset : DefaultRulesets.withBypassTeams(
                DefaultRulesets.load(config.getDefaultRulesetsPath()), config.getBypassTeams(), index)) {
            template.add(sanitizer.sanitize(ruleset));
        }
        LOGGER.log(Level.INFO, "Writing {0} default rule sets to {1}", new Object[] {template.size(), targets});
        return reconciler.reconcileDefaults(template, targets);
    }

    /**
     * Creates or updates the rule sets of documents written by {@code get-rules}, in the repositories named by their
     * {@code source}.
     */
    @NonNull
    public RulesetReconciler.Result setRepositoryRulesets(@NonNull List<Path> files) throws IOException {
        List<JsonObject> desired = new ArrayList<>();
        for (Path file : files) {
            for (JsonObject ruleset : readDocument(file)) {
                desired.add(sanitizer.sanitize(ruleset));
            }
        }
        LOGGER.log(Level.INFO, "Read {0} rule sets from {1}", new Object[] {desired.size(), files});
        return reconciler.reconcile(desired);
    }

    static List<JsonObject> readDocument(Path file) throws IOException {
        JsonElement document;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            document = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new MalformedRulesetException("Failed to parse " + file + ": " + e.getMessage());
        }
        List<JsonObject> rulesets = new ArrayList<>();
        if (document.isJsonObject()) {
            rulesets.add(document.getAsJsonObject());
            return rulesets;
        }
        if (!document.isJsonArray()) {
            throw new MalformedRulesetException(file + " contains neither a rule set nor a list of rule sets");
        }
        for (JsonElement element : document.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new MalformedRulesetException(file + " contains an invalid rule set: " + element);
            }
            rulesets.add(element.getAsJsonObject());
        }
        return rulesets;
    }

    /**
     * Accepts {@code repository} as well as {@code organization/repository}, in any case.
     *
     * @throws UnresolvedReferenceException for repositories outside of the organization
     */
    List<String> resolveRepositories(List<String> requested) throws IOException {
        List<String> known = index.repositories();
        if (requested.isEmpty()) {
            return known;
        }
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String name : requested) {
            String repository = name;
            int slash = name.indexOf('/');
            if (slash >= 0) {
                if (!name.substring(0, slash).equalsIgnoreCase(config.getOrganization())) {
                    throw new UnresolvedReferenceException(name + " is not a repository of " + config.getOrganization());
                }
                repository = name.substring(slash + 1);
            }
            result.add(canonicalName(known, repository, name));
        }
        return new ArrayList<>(result);
    }

    private static String canonicalName(List<String> known, String repository, String requested) {
        for (String candidate : known) {
            if (candidate.equalsIgnoreCase(repository)) {
                return candidate;
            }
        }
        throw new UnresolvedReferenceException("Unknown repository: " + requested);
    }
}
