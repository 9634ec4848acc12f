package io.jenkins.infra.repository_rulesets_updater;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

/**
 * Reads the GitHub token from a credentials file containing a {@code github.token=<token>} line.
 */
public final class Credentials {

    static final String TOKEN_KEY = "github.token";

    /**
     * Prefixes of personal access, OAuth, user-to-server, server-to-server and refresh tokens.
     *
     * @link https://github.blog/engineering/platform-security/behind-githubs-new-authentication-token-formats/
     */
    static final List<String> TOKEN_PREFIXES = List.of("ghp_", "github_pat_", "gho_", "ghu_", "ghs_", "ghr_");

    /**
     * @return the token
     * @throws IllegalArgumentException if the file has no token or the token is not a GitHub token
     */
    @NonNull
    public static String loadToken(@NonNull Path file) throws IOException {
        if (!Files.isReadable(file)) {
            throw new IOException("Credentials file is not readable: " + file);
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        String token = properties.getProperty(TOKEN_KEY);
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("No " + TOKEN_KEY + " in " + file);
        }
        String trimmed = token.trim();
        if (TOKEN_PREFIXES.stream().noneMatch(trimmed::startsWith)) {
            // don't echo the token
            throw new IllegalArgumentException("Unrecognized " + TOKEN_KEY + " format in " + file);
        }
        return trimmed;
    }

    private Credentials() {
        /* prevent instantiation */
    }
}
