package io.jenkins.infra.repository_rulesets_updater.github;

import java.io.IOException;

/**
 * Thrown when the GitHub API answers with a status outside of the set the caller accepts.
 * Such failures are never retried.
 */
public class UnexpectedStatusException extends IOException {

    private final String url;
    private final int status;
    private final String reason;

    public UnexpectedStatusException(String url, int status, String reason) {
        super("Unexpected response from " + url + ": HTTP " + status + (reason == null ? "" : " " + reason));
        this.url = url;
        this.status = status;
        this.reason = reason;
    }

    public String getUrl() {
        return url;
    }

    public int getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
