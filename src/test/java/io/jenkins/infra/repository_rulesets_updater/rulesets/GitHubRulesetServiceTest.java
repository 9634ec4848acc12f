package io.jenkins.infra.repository_rulesets_updater.rulesets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.jenkins.infra.repository_rulesets_updater.github.GitHubClient;
import io.jenkins.infra.repository_rulesets_updater.github.Page;
import io.jenkins.infra.repository_rulesets_updater.github.PageFolder;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GitHubRulesetServiceTest {

    @Mock
    private GitHubClient client;

    private GitHubRulesetService service;

    @BeforeEach
    void setUp() {
        PageFolder folder = new PageFolder((path, query) -> {
            if (!path.equals("/repos/jenkinsci/core/rulesets")) {
                throw new IOException("Unexpected " + path);
            }
            if (query.get("page").equals("1")) {
                return new Page(JsonParser.parseString("[{\"id\": 1, \"name\": \"a\"}]"), 2);
            }
            return new Page(JsonParser.parseString("[{\"id\": 2, \"name\": \"b\"}]"), null);
        });
        service = new GitHubRulesetService(client, folder, "jenkinsci");
    }

    @Test
    void testListSummariesFollowsPages() throws IOException {
        List<JsonObject> summaries = service.listRulesetSummaries("core");

        assertEquals(2, summaries.size());
        assertEquals("b", summaries.get(1).get("name").getAsString());
    }

    @Test
    void testGetRuleset() throws IOException {
        JsonObject ruleset = JsonParser.parseString("{\"id\": 2}").getAsJsonObject();
        when(client.get("/repos/jenkinsci/core/rulesets/2")).thenReturn(ruleset);

        assertSame(ruleset, service.getRuleset("core", 2));
    }

    @Test
    void testGetRulesetRejectsNonObject() throws IOException {
        when(client.get("/repos/jenkinsci/core/rulesets/2")).thenReturn(new JsonArray());

        assertThrows(IOException.class, () -> service.getRuleset("core", 2));
    }

    @Test
    void testWrites() throws IOException {
        JsonObject payload = new JsonObject();

        service.createRuleset("core", payload);
        service.updateRuleset("core", 5, payload);

        verify(client).post("/repos/jenkinsci/core/rulesets", payload);
        verify(client).put("/repos/jenkinsci/core/rulesets/5", payload);
    }
}
