package io.jenkins.infra.repository_rulesets_updater;

/**
 * A name that could not be resolved to an id, or a reference to a repository outside of the configured organization.
 */
public class UnresolvedReferenceException extends IllegalArgumentException {

    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
