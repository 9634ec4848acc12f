package io.jenkins.infra.repository_rulesets_updater.github;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-run lookups of an organization's teams and repositories. Each collection is fetched on first use and kept for
 * the rest of the run.
 */
public class OrganizationIndex implements TeamLookup {
    private static final Logger LOGGER = Logger.getLogger(OrganizationIndex.class.getName());

    private static final Map<String, String> SORTED = Map.of("sort", "full_name");

    private final PageFolder folder;
    private final String organization;
    private final List<String> configuredTeams;

    private NameIdCache teams;
    private List<String> repositories;

    /**
     * @param folder folds the collection endpoints
     * @param organization the organization login
     * @param configuredTeams the teams this run is restricted to, empty for all of them
     */
    public OrganizationIndex(
            @NonNull PageFolder folder, @NonNull String organization, @NonNull List<String> configuredTeams) {
        this.folder = folder;
        this.organization = organization;
        this.configuredTeams = List.copyOf(configuredTeams);
    }

    @NonNull
    public String getOrganization() {
        return organization;
    }

    /**
     * @return the complete team mapping, regardless of any configured restriction
     */
    @NonNull
    public NameIdCache teams() throws IOException {
        if (teams == null) {
            Map<String, Long> ids = folder.nameToId("/orgs/" + organization + "/teams", SORTED);
            LOGGER.log(Level.INFO, "Found {0} teams in {1}", new Object[] {ids.size(), organization});
            teams = new NameIdCache("team", ids);
        }
        return teams;
    }

    /**
     * @return the configured teams if the run is restricted to some, otherwise all teams, sorted
     * @throws UnresolvedReferenceException if a configured team does not exist
     */
    @NonNull
    public List<String> teamNames() throws IOException {
        NameIdCache all = teams();
        if (configuredTeams.isEmpty()) {
            return new ArrayList<>(all.names());
        }
        for (String name : configuredTeams) {
            all.idOf(name);
        }
        return configuredTeams;
    }

    @Override
    public long teamId(@NonNull String name) throws IOException {
        return teams().idOf(name);
    }

    @Override
    @NonNull
    public String teamName(long id) throws IOException {
        return teams().nameOf(id);
    }

    /**
     * @return the names of all repositories of the organization, ordered by full name
     */
    @NonNull
    public List<String> repositories() throws IOException {
        if (repositories == null) {
            repositories = Collections.unmodifiableList(folder.names("/orgs/" + organization + "/repos", SORTED));
            LOGGER.log(Level.INFO, "Found {0} repositories in {1}", new Object[] {repositories.size(), organization});
        }
        return repositories;
    }
}
