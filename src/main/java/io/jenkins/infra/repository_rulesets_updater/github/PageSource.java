package io.jenkins.infra.repository_rulesets_updater.github;

import java.io.IOException;
import java.util.Map;

/**
 * Fetches a single page of a collection endpoint.
 */
@FunctionalInterface
public interface PageSource {

    /**
     * @param path the collection path, relative to the API root
     * @param query the query parameters, including {@code page} and {@code per_page}
     * @return the decoded page
     */
    Page fetchPage(String path, Map<String, String> query) throws IOException;
}
