package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class RulesetEmitterTest {

    private static final String RULESET = "{\"id\": 1, \"name\": \"n\", \"source\": \"o/r\", \"source_type\": \"Repository\","
            + " \"target\": \"branch\", \"enforcement\": \"active\", \"created_at\": \"2024-03-01\","
            + " \"bypass_actors\": [{\"actor_id\": 5, \"actor_type\": \"Team\", \"bypass_mode\": \"always\"},"
            + " {\"actor_id\": 7, \"actor_type\": \"Integration\", \"bypass_mode\": \"always\"}],"
            + " \"conditions\": {\"ref_name\": {\"include\": [\"~DEFAULT_BRANCH\"], \"exclude\": []}},"
            + " \"rules\": [{\"type\": \"deletion\"},"
            + " {\"type\": \"pull_request\", \"parameters\": {\"required_approving_review_count\": 1}}],"
            + " \"_links\": {\"html\": {\"href\": \"https://github.com/o/r/rules/1\"}}}";

    private static JsonObject ruleset() {
        return JsonParser.parseString(RULESET).getAsJsonObject();
    }

    @Test
    void testLayout() throws IOException {
        String expected = "[\n"
                + "  {\n"
                + "    \"id\": 1,\n"
                + "    \"source\": \"o/r\",\n"
                + "    \"source_type\": \"Repository\",\n"
                + "    \"name\": \"n\",\n"
                + "    \"enforcement\": \"active\",\n"
                + "    \"target\": \"branch\",\n"
                + "    \"bypass_actors\": [\n"
                + "      {\"actor_id\": 5, \"actor_type\": \"Team\", \"bypass_mode\": \"always\"},\n"
                + "      {\"actor_id\": 7, \"actor_type\": \"Integration\", \"bypass_mode\": \"always\"}\n"
                + "    ],\n"
                + "    \"conditions\": {\n"
                + "      \"ref_name\": {\n"
                + "        \"include\": [\n"
                + "          \"~DEFAULT_BRANCH\"\n"
                + "        ],\n"
                + "        \"exclude\": []\n"
                + "      }\n"
                + "    },\n"
                + "    \"rules\": [\n"
                + "      {\"type\": \"deletion\"},\n"
                + "      {\"type\": \"pull_request\", \"parameters\": {\"required_approving_review_count\": 1}}\n"
                + "    ]\n"
                + "  }\n"
                + "]\n";

        assertEquals(expected, new RulesetEmitter(2, false, null).emit(List.of(ruleset())));
    }

    @Test
    void testNestedValuesInFlatEntries() throws IOException {
        JsonObject ruleset = JsonParser.parseString("{\"name\": \"n\", \"rules\": [{\"type\": \"required_status_checks\","
                        + " \"parameters\": {\"strict_required_status_checks_policy\": true,"
                        + " \"required_status_checks\": [{\"context\": \"ci/build\"}, {\"context\": \"ci/test\"}],"
                        + " \"do_not_enforce_on_create\": false, \"empty\": {}, \"none\": []}}]}")
                .getAsJsonObject();

        String document = new RulesetEmitter(2, false, null).emit(List.of(ruleset));

        assertTrue(document.contains("      {\"type\": \"required_status_checks\", \"parameters\": "
                + "{\"strict_required_status_checks_policy\": true, \"required_status_checks\": "
                + "[{\"context\": \"ci/build\"}, {\"context\": \"ci/test\"}], \"do_not_enforce_on_create\": false, "
                + "\"empty\": {}, \"none\": []}}\n"));
        assertEquals(ruleset, JsonParser.parseString(document).getAsJsonArray().get(0));
    }

    @Test
    void testEmptyList() throws IOException {
        assertEquals("[]\n", new RulesetEmitter(2, false, null).emit(List.of()));
    }

    @Test
    void testSeveralRulesetsParseBack() throws IOException {
        String document = new RulesetEmitter(3, false, null).emit(List.of(ruleset(), ruleset()));

        assertEquals(2, JsonParser.parseString(document).getAsJsonArray().size());
        assertTrue(document.contains("\n   {\n      \"id\": 1,"));
    }

    @Test
    void testTeamActorsAreNamed() throws IOException {
        String document = new RulesetEmitter(1, false, RulesetSanitizerTest.TEAMS).emit(List.of(ruleset()));

        assertTrue(document.contains(
                "  {\"actor_id\": 5, \"actor_name\": \"core\", \"actor_type\": \"Team\", \"bypass_mode\": \"always\"},\n"));
        assertTrue(document.contains("  {\"actor_id\": 7, \"actor_type\": \"Integration\", \"bypass_mode\": \"always\"}\n"));
    }

    @Test
    void testVerbose() throws IOException {
        JsonObject emitted = JsonParser.parseString(new RulesetEmitter(2, true, null).emit(List.of(ruleset())))
                .getAsJsonArray()
                .get(0)
                .getAsJsonObject();

        assertEquals("2024-03-01", emitted.get("created_at").getAsString());
        assertEquals("https://github.com/o/r/rules/1", emitted.get("link").getAsString());
        assertFalse(emitted.has("updated_at"));
        assertFalse(emitted.has("_links"));
    }

    @Test
    void testPlainOutputHasNoExtraKeys() throws IOException {
        JsonObject emitted = JsonParser.parseString(new RulesetEmitter(2, false, null).emit(List.of(ruleset())))
                .getAsJsonArray()
                .get(0)
                .getAsJsonObject();

        assertEquals(RulesetFields.KEYS, List.copyOf(emitted.keySet()));
    }

    @Test
    void testIndentBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RulesetEmitter(0, false, null));
        assertThrows(IllegalArgumentException.class, () -> new RulesetEmitter(9, false, null));
    }

    @Test
    void testRepeat() {
        assertEquals("", RulesetEmitter.repeat(' ', 0));
        assertEquals("---", RulesetEmitter.repeat('-', 3));
    }
}
