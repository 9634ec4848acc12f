package io.jenkins.infra.repository_rulesets_updater.cli.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GetRulesCommandTest {

    @TempDir
    Path tmp;

    @Test
    void testNewFileInExistingDirectory() {
        assertNull(GetRulesCommand.checkWritable(tmp.resolve("rules.json")));
    }

    @Test
    void testExistingFileIsOverwritten() throws IOException {
        Path file = Files.writeString(tmp.resolve("rules.json"), "[]", StandardCharsets.UTF_8);

        assertNull(GetRulesCommand.checkWritable(file));
    }

    @Test
    void testMissingDirectory() {
        assertEquals(
                "directory does not exist",
                GetRulesCommand.checkWritable(tmp.resolve("missing").resolve("rules.json")));
    }

    @Test
    void testDirectoryIsNotAFile() {
        assertEquals("not a regular file", GetRulesCommand.checkWritable(tmp));
    }
}
