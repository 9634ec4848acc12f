package io.jenkins.infra.repository_rulesets_updater.github;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reduces all pages of a collection endpoint into a single value.
 */
public class PageFolder {
    private static final Logger LOGGER = Logger.getLogger(PageFolder.class.getName());

    private final PageSource pages;

    public PageFolder(@NonNull PageSource pages) {
        this.pages = pages;
    }

    /**
     * Walks the collection from the initial query's page (default 1) until a page without next cursor was received,
     * applying {@code combine} to every record in server order.
     * A page body may be a single object or an array of objects; both are folded one record at a time.
     *
     * @param path the collection path
     * @param combine the accumulation function; may mutate or replace the accumulator
     * @param initial the initial accumulator
     * @param query the initial query
     * @return the value returned by the last {@code combine} call, or {@code initial} for an empty collection
     */
    public <A> A fold(
            @NonNull String path,
            @NonNull BiFunction<A, JsonObject, A> combine,
            A initial,
            @NonNull Map<String, String> query)
            throws IOException {
        Map<String, String> current = new LinkedHashMap<>(query);
        current.putIfAbsent("page", "1");
        A acc = initial;
        while (true) {
            Page page = pages.fetchPage(path, current);
            acc = foldBody(page.getBody(), combine, acc);
            Integer next = page.getNext();
            if (next == null) {
                return acc;
            }
            LOGGER.log(Level.FINE, "Continuing {0} with page {1}", new Object[] {path, next});
            current.put("page", String.valueOf(next));
        }
    }

    public <A> A fold(@NonNull String path, @NonNull BiFunction<A, JsonObject, A> combine, A initial)
            throws IOException {
        return fold(path, combine, initial, Map.of());
    }

    /**
     * @return the {@code name} of every record, in server order
     */
    @NonNull
    public List<String> names(@NonNull String path, @NonNull Map<String, String> query) throws IOException {
        return fold(
                path,
                (List<String> acc, JsonObject item) -> {
                    acc.add(stringField(item, "name"));
                    return acc;
                },
                new ArrayList<>(),
                query);
    }

    /**
     * @return a mapping from each record's {@code name} to its {@code id}; a repeated name keeps the last id
     */
    @NonNull
    public Map<String, Long> nameToId(@NonNull String path, @NonNull Map<String, String> query) throws IOException {
        return fold(
                path,
                (Map<String, Long> acc, JsonObject item) -> {
                    acc.put(stringField(item, "name"), longField(item, "id"));
                    return acc;
                },
                new HashMap<>(),
                query);
    }

    private static <A> A foldBody(JsonElement body, BiFunction<A, JsonObject, A> combine, A acc) {
        if (body.isJsonArray()) {
            for (JsonElement element : body.getAsJsonArray()) {
                acc = combine.apply(acc, asRecord(element));
            }
            return acc;
        }
        if (body.isJsonNull()) {
            return acc;
        }
        return combine.apply(acc, asRecord(body));
    }

    private static JsonObject asRecord(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new IllegalStateException("Expected a record but got: " + element);
        }
        return element.getAsJsonObject();
    }

    static String stringField(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            throw new IllegalStateException("Record has no '" + key + "': " + json);
        }
        return value.getAsString();
    }

    static long longField(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new IllegalStateException("Record has no numeric '" + key + "': " + json);
        }
        return value.getAsLong();
    }
}
