package io.jenkins.infra.repository_rulesets_updater.github;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.UnresolvedReferenceException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable two-way mapping between the names and ids of a collection.
 * Every {@code name -> id} entry has its mirrored {@code id -> name} entry.
 */
public final class NameIdCache {
    private final String kind;
    private final Map<String, Long> idsByName;
    private final Map<Long, String> namesById;

    /**
     * @param kind the human readable kind of object, for error messages
     * @param nameToId the names and ids to index; ids must be unique
     */
    public NameIdCache(@NonNull String kind, @NonNull Map<String, Long> nameToId) {
        this.kind = kind;
        Map<String, Long> byName = new HashMap<>();
        Map<Long, String> byId = new HashMap<>();
        nameToId.forEach((name, id) -> {
            String previous = byId.put(id, name);
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate " + kind + " id " + id + " for '" + previous + "' and '" + name + "'");
            }
            byName.put(name, id);
        });
        this.idsByName = Collections.unmodifiableMap(byName);
        this.namesById = Collections.unmodifiableMap(byId);
    }

    public boolean containsName(String name) {
        return idsByName.containsKey(name);
    }

    /**
     * @throws UnresolvedReferenceException if there is no such name
     */
    public long idOf(@NonNull String name) {
        Long id = idsByName.get(name);
        if (id == null) {
            throw new UnresolvedReferenceException("Unknown " + kind + ": '" + name + "'");
        }
        return id;
    }

    /**
     * @throws UnresolvedReferenceException if there is no such id
     */
    @NonNull
    public String nameOf(long id) {
        String name = namesById.get(id);
        if (name == null) {
            throw new UnresolvedReferenceException("Unknown " + kind + " id: " + id);
        }
        return name;
    }

    /**
     * @return all names, sorted
     */
    @NonNull
    public Set<String> names() {
        return new TreeSet<>(idsByName.keySet());
    }

    @NonNull
    public Map<String, Long> idsByName() {
        return idsByName;
    }

    @NonNull
    public Map<Long, String> namesById() {
        return namesById;
    }

    public int size() {
        return idsByName.size();
    }
}
