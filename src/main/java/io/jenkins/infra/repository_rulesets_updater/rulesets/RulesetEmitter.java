package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetFields.*;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.jenkins.infra.repository_rulesets_updater.github.TeamLookup;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes rule sets as an indented JSON array meant to be read by humans and by {@code set-repo-rules}.
 * <p>
 * Bypass actors and rules are written one flat object per line. Conditions are written with one level of indentation
 * per nesting level and one line per pattern.
 * <p>
 * With actor mapping or verbose output enabled, the result carries keys GitHub does not accept; it has to go through
 * {@link RulesetSanitizer} before it can be written back.
 */
public class RulesetEmitter {

    public static final int MIN_INDENT = 1;
    public static final int MAX_INDENT = 8;

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final int width;
    private final boolean verbose;
    private final TeamLookup teams;

    private int depth;

    /**
     * @param width the number of spaces per indentation level, {@value #MIN_INDENT} to {@value #MAX_INDENT}
     * @param verbose whether to add timestamps and the rule set's web link
     * @param teams if not {@code null}, Team bypass actors get an additional {@code actor_name}
     */
    public RulesetEmitter(int width, boolean verbose, @CheckForNull TeamLookup teams) {
        if (width < MIN_INDENT || width > MAX_INDENT) {
            throw new IllegalArgumentException(
                    "Indent must be between " + MIN_INDENT + " and " + MAX_INDENT + ": " + width);
        }
        this.width = width;
        this.verbose = verbose;
        this.teams = teams;
    }

    @NonNull
    public String emit(@NonNull List<JsonObject> rulesets) throws IOException {
        StringBuilder sb = new StringBuilder();
        emit(rulesets, sb);
        return sb.toString();
    }

    public void emit(@NonNull List<JsonObject> rulesets, @NonNull Appendable out) throws IOException {
        depth = 0;
        if (rulesets.isEmpty()) {
            out.append("[]\n");
            return;
        }
        out.append("[\n");
        depth++;
        for (Iterator<JsonObject> it = rulesets.iterator(); it.hasNext(); ) {
            out.append(indent());
            emitRuleset(it.next(), out);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        depth--;
        out.append("]\n");
    }

    private void emitRuleset(JsonObject ruleset, Appendable out) throws IOException {
        JsonObject view = report(ruleset);
        out.append("{\n");
        depth++;
        for (Iterator<Map.Entry<String, JsonElement>> it = view.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, JsonElement> entry = it.next();
            out.append(indent()).append(GSON.toJson(entry.getKey())).append(": ");
            switch (entry.getKey()) {
                case BYPASS_ACTORS:
                    emitFlatObjects(mapActors(entry.getValue()), out);
                    break;
                case RULES:
                    emitFlatObjects(entry.getValue(), out);
                    break;
                default:
                    emitNested(entry.getValue(), out);
                    break;
            }
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        depth--;
        out.append(indent()).append('}');
    }

    private JsonObject report(JsonObject ruleset) {
        JsonObject view = new JsonObject();
        for (String key : verbose ? VERBOSE_KEYS : KEYS) {
            JsonElement value = LINK.equals(key) ? htmlLink(ruleset) : ruleset.get(key);
            if (value != null) {
                view.add(key, value);
            }
        }
        return view;
    }

    @CheckForNull
    private static JsonElement htmlLink(JsonObject ruleset) {
        JsonElement links = ruleset.get(LINKS);
        if (links == null || !links.isJsonObject()) {
            return null;
        }
        JsonElement html = links.getAsJsonObject().get("html");
        if (html == null || !html.isJsonObject()) {
            return null;
        }
        return html.getAsJsonObject().get("href");
    }

    private JsonElement mapActors(JsonElement actors) throws IOException {
        if (teams == null || !actors.isJsonArray()) {
            return actors;
        }
        JsonArray mapped = new JsonArray();
        for (JsonElement element : actors.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                mapped.add(element);
                continue;
            }
            JsonObject actor = element.getAsJsonObject();
            JsonElement id = actor.get(ACTOR_ID);
            JsonElement type = actor.get(ACTOR_TYPE);
            if (type == null || !ACTOR_TYPE_TEAM.equals(type.getAsString()) || id == null || id.isJsonNull()) {
                mapped.add(actor);
                continue;
            }
            Map<String, JsonElement> sorted = new TreeMap<>(actor.asMap());
            sorted.put(ACTOR_NAME, new JsonPrimitive(teams.teamName(id.getAsLong())));
            JsonObject named = new JsonObject();
            sorted.forEach(named::add);
            mapped.add(named);
        }
        return mapped;
    }

    private void emitFlatObjects(JsonElement value, Appendable out) throws IOException {
        if (!value.isJsonArray() || value.getAsJsonArray().isEmpty()) {
            out.append(GSON.toJson(value));
            return;
        }
        out.append("[\n");
        depth++;
        for (Iterator<JsonElement> it = value.getAsJsonArray().iterator(); it.hasNext(); ) {
            out.append(indent());
            emitFlat(it.next(), out);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        depth--;
        out.append(indent()).append(']');
    }

    /**
     * Writes a value on a single line, nested objects and lists included.
     */
    private static void emitFlat(JsonElement value, Appendable out) throws IOException {
        if (value.isJsonObject() && !value.getAsJsonObject().isEmpty()) {
            out.append('{');
            for (Iterator<Map.Entry<String, JsonElement>> it =
                            value.getAsJsonObject().entrySet().iterator();
                    it.hasNext(); ) {
                Map.Entry<String, JsonElement> entry = it.next();
                out.append(GSON.toJson(entry.getKey())).append(": ");
                emitFlat(entry.getValue(), out);
                if (it.hasNext()) {
                    out.append(", ");
                }
            }
            out.append('}');
        } else if (value.isJsonArray() && !value.getAsJsonArray().isEmpty()) {
            out.append('[');
            for (Iterator<JsonElement> it = value.getAsJsonArray().iterator(); it.hasNext(); ) {
                emitFlat(it.next(), out);
                if (it.hasNext()) {
                    out.append(", ");
                }
            }
            out.append(']');
        } else {
            out.append(GSON.toJson(value));
        }
    }

    private void emitNested(JsonElement value, Appendable out) throws IOException {
        if (value.isJsonObject() && !value.getAsJsonObject().isEmpty()) {
            out.append("{\n");
            depth++;
            for (Iterator<Map.Entry<String, JsonElement>> it =
                            value.getAsJsonObject().entrySet().iterator();
                    it.hasNext(); ) {
                Map.Entry<String, JsonElement> entry = it.next();
                out.append(indent()).append(GSON.toJson(entry.getKey())).append(": ");
                emitNested(entry.getValue(), out);
                out.append(it.hasNext() ? ",\n" : "\n");
            }
            depth--;
            out.append(indent()).append('}');
        } else if (value.isJsonArray() && !value.getAsJsonArray().isEmpty()) {
            out.append("[\n");
            depth++;
            for (Iterator<JsonElement> it = value.getAsJsonArray().iterator(); it.hasNext(); ) {
                out.append(indent());
                emitFlat(it.next(), out);
                out.append(it.hasNext() ? ",\n" : "\n");
            }
            depth--;
            out.append(indent()).append(']');
        } else {
            out.append(GSON.toJson(value));
        }
    }

    private String indent() {
        return repeat(' ', width * depth);
    }

    static String repeat(char c, int count) {
        return String.valueOf(c).repeat(count);
    }
}
