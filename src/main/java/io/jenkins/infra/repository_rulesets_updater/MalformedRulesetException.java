package io.jenkins.infra.repository_rulesets_updater;

/**
 * A rule set document that cannot be written to GitHub as it is.
 */
public class MalformedRulesetException extends IllegalArgumentException {

    public MalformedRulesetException(String message) {
        super(message);
    }
}
