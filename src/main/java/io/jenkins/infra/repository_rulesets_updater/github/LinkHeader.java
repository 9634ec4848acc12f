package io.jenkins.infra.repository_rulesets_updater.github;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the pagination cursor out of a {@code link} response header.
 *
 * @link https://docs.github.com/en/rest/using-the-rest-api/using-pagination-in-the-rest-api
 */
public final class LinkHeader {

    private static final Pattern ENTRY = Pattern.compile("<([^>]*)>\\s*;\\s*rel=\"([^\"]*)\"");

    /**
     * Locates the {@code rel="next"} entry of the header and returns the value of the {@code page} query parameter
     * of its URL.
     *
     * @param header the raw header value, possibly {@code null}
     * @return the next page number, or {@code null} if the header has no next relation
     */
    @CheckForNull
    public static Integer nextPage(@CheckForNull String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        Matcher m = ENTRY.matcher(header);
        while (m.find()) {
            // rel may hold several space separated relation types
            if (Arrays.asList(m.group(2).trim().split("\\s+")).contains("next")) {
                String page = queryParameters(m.group(1)).get("page");
                if (page == null) {
                    throw new IllegalArgumentException("next link without page parameter: " + m.group(1));
                }
                return Integer.valueOf(page);
            }
        }
        return null;
    }

    static Map<String, String> queryParameters(String url) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = URI.create(url).getRawQuery();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(
                    URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private LinkHeader() {
        /* prevent instantiation */
    }
}
