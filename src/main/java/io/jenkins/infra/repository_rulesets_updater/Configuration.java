package io.jenkins.infra.repository_rulesets_updater;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.jenkins.infra.repository_rulesets_updater.github.GitHubClient;
import io.jenkins.infra.repository_rulesets_updater.rulesets.RulesetEmitter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Settings of a run, read from a YAML file. {@code organization}, {@code apiUrl} and {@code credentialsFile} can be
 * overridden with system properties of the same name.
 */
@SuppressFBWarnings("EI_EXPOSE_REP")
public class Configuration {

    /**
     * Read when no configuration file is given and it exists.
     */
    public static final Path DEFAULT_FILE = Path.of("rulesets-updater.yml");

    private String organization;
    private String apiUrl = GitHubClient.DEFAULT_API_URL;
    private String credentialsFile = "~/.github-credentials";
    private List<String> teams = new ArrayList<>();
    private List<String> bypassTeams = new ArrayList<>();
    private String defaultRulesets;
    private int indent = 2;
    private int pageSize = GitHubClient.MAX_PAGE_SIZE;
    private boolean readOnly;

    /**
     * Loads the configuration file, applies system property overrides and validates the result.
     *
     * @param file the YAML file, or {@code null} to start from the defaults
     */
    @NonNull
    public static Configuration load(@CheckForNull Path file) throws IOException {
        Configuration config = new Configuration();
        if (file != null) {
            Yaml yaml = new Yaml(new Constructor(Configuration.class, new LoaderOptions()));
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                Configuration loaded = yaml.loadAs(reader, Configuration.class);
                if (loaded != null) {
                    config = loaded;
                }
            } catch (YAMLException e) {
                throw new IOException("Failed to read " + file, e);
            }
        }
        config.organization = System.getProperty("organization", config.organization);
        config.apiUrl = System.getProperty("apiUrl", config.apiUrl);
        config.credentialsFile = System.getProperty("credentialsFile", config.credentialsFile);
        config.validate();
        return config;
    }

    void validate() {
        if (organization == null || organization.isBlank()) {
            throw new IllegalArgumentException("No organization configured");
        }
        if (indent < RulesetEmitter.MIN_INDENT || indent > RulesetEmitter.MAX_INDENT) {
            throw new IllegalArgumentException("indent must be between " + RulesetEmitter.MIN_INDENT + " and "
                    + RulesetEmitter.MAX_INDENT + ", got " + indent);
        }
        if (pageSize < 1 || pageSize > GitHubClient.MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    "pageSize must be between 1 and " + GitHubClient.MAX_PAGE_SIZE + ", got " + pageSize);
        }
        if (teams == null) {
            teams = new ArrayList<>();
        }
        if (bypassTeams == null) {
            bypassTeams = new ArrayList<>();
        }
    }

    /**
     * @return the credentials file, with a leading {@code ~} replaced by the user's home directory
     */
    @NonNull
    public Path getCredentialsPath() {
        return expandHome(credentialsFile);
    }

    /**
     * @return the default rule set template, or {@code null} for the bundled one
     */
    @CheckForNull
    public Path getDefaultRulesetsPath() {
        return defaultRulesets == null ? null : expandHome(defaultRulesets);
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    public String getOrganization() {
        return organization;
    }

    public void setOrganization(String organization) {
        this.organization = organization;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getCredentialsFile() {
        return credentialsFile;
    }

    public void setCredentialsFile(String credentialsFile) {
        this.credentialsFile = credentialsFile;
    }

    public List<String> getTeams() {
        return teams;
    }

    public void setTeams(List<String> teams) {
        this.teams = teams;
    }

    public List<String> getBypassTeams() {
        return bypassTeams;
    }

    public void setBypassTeams(List<String> bypassTeams) {
        this.bypassTeams = bypassTeams;
    }

    public String getDefaultRulesets() {
        return defaultRulesets;
    }

    public void setDefaultRulesets(String defaultRulesets) {
        this.defaultRulesets = defaultRulesets;
    }

    public int getIndent() {
        return indent;
    }

    public void setIndent(int indent) {
        this.indent = indent;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }
}
