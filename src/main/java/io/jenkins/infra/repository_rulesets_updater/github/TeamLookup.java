package io.jenkins.infra.repository_rulesets_updater.github;

import java.io.IOException;

/**
 * Resolves team names to ids and back.
 */
public interface TeamLookup {

    long teamId(String name) throws IOException;

    String teamName(long id) throws IOException;
}
