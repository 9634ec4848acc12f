package io.jenkins.infra.repository_rulesets_updater.github;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Blocking client for the small part of the GitHub REST API this tool needs.
 * Each call is one round trip; statuses outside of the accepted set are turned into
 * {@link UnexpectedStatusException} and never retried.
 */
public class GitHubClient implements PageSource {
    private static final Logger LOGGER = Logger.getLogger(GitHubClient.class.getName());

    public static final String DEFAULT_API_URL = "https://api.github.com";

    /**
     * The maximum page size the API accepts.
     */
    public static final int MAX_PAGE_SIZE = 100;

    static final String API_VERSION = "2022-11-28";
    static final String MEDIA_TYPE = "application/vnd.github+json";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final String apiUrl;
    private final String bearerToken;
    private final int pageSize;

    public GitHubClient(@NonNull String apiUrl, @NonNull String token) {
        this(apiUrl, token, MAX_PAGE_SIZE);
    }

    public GitHubClient(@NonNull String apiUrl, @NonNull String token, int pageSize) {
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE + ": " + pageSize);
        }
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.bearerToken = "Bearer " + token;
        this.pageSize = pageSize;
    }

    /**
     * Fetches one page of a collection. {@code per_page} defaults to the configured page size and {@code page} to 1
     * unless the query already carries them.
     *
     * @param path the collection path, e.g. {@code /orgs/jenkinsci/repos}
     * @param query additional query parameters, in the order they should appear
     * @return the decoded page together with the next cursor read from the {@code link} header
     */
    @Override
    @NonNull
    public Page fetchPage(@NonNull String path, @NonNull Map<String, String> query) throws IOException {
        Map<String, String> params = new LinkedHashMap<>(query);
        params.putIfAbsent("per_page", String.valueOf(pageSize));
        params.putIfAbsent("page", "1");
        Response response = send("GET", toUrl(path, params), null, Set.of(HttpURLConnection.HTTP_OK));
        return new Page(response.body, LinkHeader.nextPage(response.link));
    }

    /**
     * Reads a single resource.
     */
    @NonNull
    public JsonElement get(@NonNull String path) throws IOException {
        return send("GET", toUrl(path, Map.of()), null, Set.of(HttpURLConnection.HTTP_OK)).body;
    }

    /**
     * Creates a resource. Anything but {@code 201 Created} is a failure.
     *
     * @return the created resource as returned by the server
     */
    @NonNull
    public JsonObject post(@NonNull String path, @NonNull JsonObject payload) throws IOException {
        return asObject(send("POST", toUrl(path, Map.of()), payload, Set.of(HttpURLConnection.HTTP_CREATED)));
    }

    /**
     * Replaces a resource. Anything but {@code 200 OK} is a failure.
     *
     * @return the updated resource as returned by the server
     */
    @NonNull
    public JsonObject put(@NonNull String path, @NonNull JsonObject payload) throws IOException {
        return asObject(send("PUT", toUrl(path, Map.of()), payload, Set.of(HttpURLConnection.HTTP_OK)));
    }

    String toUrl(String path, Map<String, String> query) {
        StringBuilder sb = new StringBuilder(apiUrl);
        if (!path.startsWith("/")) {
            sb.append('/');
        }
        sb.append(path);
        if (!query.isEmpty()) {
            sb.append('?')
                    .append(query.entrySet().stream()
                            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + '='
                                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                            .collect(Collectors.joining("&")));
        }
        return sb.toString();
    }

    private static JsonObject asObject(Response response) throws IOException {
        if (!response.body.isJsonObject()) {
            throw new IOException("Expected a JSON object from " + response.url + " but got: " + response.body);
        }
        return response.body.getAsJsonObject();
    }

    @SuppressFBWarnings("URLCONNECTION_SSRF_FD")
    private Response send(String verb, String url, @CheckForNull JsonObject payload, Set<Integer> accepted)
            throws IOException {
        URL _url = URI.create(url).toURL();
        HttpURLConnection conn = (HttpURLConnection) _url.openConnection();
        conn.setRequestMethod(verb);
        // The GitHub API doesn't do an auth challenge
        conn.setRequestProperty("Authorization", bearerToken);
        conn.setRequestProperty("Accept", MEDIA_TYPE);
        conn.setRequestProperty("Content-Type", MEDIA_TYPE);
        conn.setRequestProperty("X-GitHub-Api-Version", API_VERSION);

        if (payload != null) {
            String json = GSON.toJson(payload);
            LOGGER.log(Level.INFO, "Sending {0} to {1}: {2}", new Object[] {verb, url, json});
            conn.setDoOutput(true);
            try (OutputStreamWriter osw = new OutputStreamWriter(conn.getOutputStream(), StandardCharsets.UTF_8)) {
                osw.write(json);
            }
        } else {
            LOGGER.log(Level.INFO, "Sending {0} to {1}", new Object[] {verb, url});
        }

        int code = conn.getResponseCode();
        String reason = conn.getResponseMessage();
        LOGGER.log(Level.INFO, "{0} request to {1} returned: HTTP {2} {3}", new Object[] {verb, url, code, reason});

        if (!accepted.contains(code)) {
            String error = readFully(conn.getErrorStream());
            if (!error.isEmpty()) {
                LOGGER.log(Level.INFO, "{0} request to {1} returned error: {2}", new Object[] {verb, url, error});
            }
            throw new UnexpectedStatusException(url, code, reason);
        }

        String text = readFully(conn.getInputStream());
        JsonElement body;
        try {
            body = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new IOException("Failed to parse GitHub response from " + url, e);
        }
        return new Response(url, body, conn.getHeaderField("link"));
    }

    private static String readFully(@CheckForNull InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (BufferedReader bufferedReader =
                new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return bufferedReader.lines().collect(Collectors.joining("\n"));
        }
    }

    private static final class Response {
        private final String url;
        private final JsonElement body;
        private final String link;

        private Response(String url, JsonElement body, String link) {
            this.url = url;
            this.body = body;
            this.link = link;
        }
    }
}
