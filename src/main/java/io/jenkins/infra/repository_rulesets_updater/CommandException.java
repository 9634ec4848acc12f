package io.jenkins.infra.repository_rulesets_updater;

/**
 * A command that is not allowed by the current configuration.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }
}
