package io.jenkins.infra.repository_rulesets_updater.github;

import com.google.gson.JsonElement;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * One decoded page of a collection endpoint, with the cursor of the page following it.
 */
public final class Page {
    private final JsonElement body;
    private final Integer next;

    public Page(@NonNull JsonElement body, @CheckForNull Integer next) {
        this.body = body;
        this.next = next;
    }

    /**
     * @return the decoded body, either a single record or an array of records
     */
    @NonNull
    public JsonElement getBody() {
        return body;
    }

    /**
     * @return the number of the next page, or {@code null} when this page is the last one
     */
    @CheckForNull
    public Integer getNext() {
        return next;
    }

    public boolean isLast() {
        return next == null;
    }
}
