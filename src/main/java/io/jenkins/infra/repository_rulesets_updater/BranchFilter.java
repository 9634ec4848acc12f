package io.jenkins.infra.repository_rulesets_updater;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the branches owned by teams. A team owns the branches named {@code <team>-...}.
 */
public final class BranchFilter {

    /**
     * Team name that disables filtering.
     */
    public static final String ALL_TEAMS = "*";

    /**
     * @param branches branch names
     * @param teams team names; containing {@link #ALL_TEAMS} selects every branch
     * @return the selected branch names, sorted
     */
    @NonNull
    public static List<String> filter(@NonNull Collection<String> branches, @NonNull Collection<String> teams) {
        boolean all = teams.contains(ALL_TEAMS);
        List<String> prefixes = teams.stream().map(team -> team + "-").collect(Collectors.toList());
        return branches.stream()
                .filter(branch -> all || prefixes.stream().anyMatch(branch::startsWith))
                .sorted()
                .collect(Collectors.toList());
    }

    private BranchFilter() {
        /* prevent instantiation */
    }
}
