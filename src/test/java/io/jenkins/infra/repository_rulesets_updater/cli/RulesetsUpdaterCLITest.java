package io.jenkins.infra.repository_rulesets_updater.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class RulesetsUpdaterCLITest {

    @TempDir
    Path tmp;

    private RulesetsUpdaterCLI cli;
    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cli = new RulesetsUpdaterCLI();
        commandLine = RulesetsUpdaterCLI.commandLine(cli);
        out = new StringWriter();
        err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void closeLogFiles() {
        LogManager.getLogManager().reset();
    }

    private Path config(String content) throws IOException {
        Path file = tmp.resolve("config.yml");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testUnknownCommand() {
        assertEquals(2, commandLine.execute("delete-everything"));
        assertTrue(err.toString().contains("delete-everything"));
    }

    @Test
    void testSetDefaultRulesNeedsRepositories() {
        assertEquals(2, commandLine.execute("set-default-rules"));
    }

    @Test
    void testReadOnlyConfigurationRejectsWrites() throws IOException {
        Path config = config("organization: jenkinsci\nreadOnly: true\n");

        assertEquals(1, commandLine.execute("-c", config.toString(), "set-default-rules", "jenkins"));
        assertTrue(err.toString().startsWith("ERROR: Command set-default-rules is not allowed"));
        assertFalse(err.toString().contains("at io.jenkins"));
    }

    @Test
    void testDebugPrintsStackTrace() throws IOException {
        Path config = config("organization: jenkinsci\nreadOnly: true\n");

        assertEquals(1, commandLine.execute("--debug", "-c", config.toString(), "set-repo-rules", "rules.json"));
        assertTrue(err.toString().contains("CommandException"));
    }

    @Test
    void testMissingCredentials() throws IOException {
        Path config = config("organization: jenkinsci\ncredentialsFile: " + tmp.resolve("absent") + "\n");

        assertEquals(1, commandLine.execute("-c", config.toString(), "list-repos"));
        assertTrue(err.toString().startsWith("ERROR: Credentials file is not readable"));
    }

    @Test
    void testInvalidLogLevel() throws IOException {
        Path config = config("organization: jenkinsci\n");

        assertEquals(1, commandLine.execute("--log-level", "LOUD", "-c", config.toString(), "list-teams"));
    }

    @Test
    void testToLevel() {
        assertEquals(Level.FINE, RulesetsUpdaterCLI.toLevel("debug"));
        assertEquals(Level.SEVERE, RulesetsUpdaterCLI.toLevel("ERROR"));
        assertEquals(Level.OFF, RulesetsUpdaterCLI.toLevel("NONE"));
        assertEquals(Level.ALL, RulesetsUpdaterCLI.toLevel("ALL"));
        assertEquals(Level.WARNING, RulesetsUpdaterCLI.toLevel("warning"));
        assertThrows(IllegalArgumentException.class, () -> RulesetsUpdaterCLI.toLevel("LOUD"));
    }

    @Test
    void testLogFileIsAppended() throws IOException {
        Path logDir = tmp.resolve("logs");
        Logger logger = Logger.getLogger(RulesetsUpdaterCLITest.class.getName());

        RulesetsUpdaterCLI.configureLogging("DEBUG", logDir);
        logger.log(Level.FINE, "first {0}", "message");
        LogManager.getLogManager().reset();
        RulesetsUpdaterCLI.configureLogging("INFO", logDir);
        logger.fine("not written");
        logger.warning("second message");
        LogManager.getLogManager().reset();

        List<String> lines = Files.readAllLines(logDir.resolve(RulesetsUpdaterCLI.LOG_FILE), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        String timestamp = "\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3} ";
        assertTrue(lines.get(0).matches(timestamp + "DEBUG   first message"), lines.get(0));
        assertTrue(lines.get(1).matches(timestamp + "WARNING second message"), lines.get(1));
    }

    @Test
    void testLogDirMustBeADirectory() throws IOException {
        Path file = config("organization: jenkinsci\n");

        assertThrows(IOException.class, () -> RulesetsUpdaterCLI.configureLogging("INFO", file));
        assertEquals(1, commandLine.execute("--log-dir", file.toString(), "-c", file.toString(), "list-teams"));
        assertTrue(err.toString().startsWith("ERROR: "));
    }

    @Test
    void testOutputDirectoryMustExist() throws IOException {
        Path config = config("organization: jenkinsci\ncredentialsFile: " + tmp.resolve("absent") + "\n");
        Path output = tmp.resolve("missing").resolve("rules.json");

        assertEquals(2, commandLine.execute("-c", config.toString(), "get-rules", "-o", output.toString()));
        assertTrue(err.toString().contains("directory does not exist"), err.toString());
        assertFalse(err.toString().contains("Credentials file"));
    }

    @Test
    void testOutputMustBeAFile() throws IOException {
        Path config = config("organization: jenkinsci\ncredentialsFile: " + tmp.resolve("absent") + "\n");

        assertEquals(2, commandLine.execute("-c", config.toString(), "get-rules", "-o", tmp.toString()));
        assertTrue(err.toString().contains("not a regular file"), err.toString());
    }

    @Test
    void testWritableOutputIsAccepted() throws IOException {
        Path config = config("organization: jenkinsci\ncredentialsFile: " + tmp.resolve("absent") + "\n");
        Path output = tmp.resolve("rules.json");

        assertEquals(1, commandLine.execute("-c", config.toString(), "get-rules", "-o", output.toString()));
        assertTrue(err.toString().startsWith("ERROR: Credentials file is not readable"));
        assertFalse(Files.exists(output));
    }
}
