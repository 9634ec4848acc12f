package io.jenkins.infra.repository_rulesets_updater.rulesets;

import java.util.List;

/**
 * Key sets of GitHub repository rule sets.
 *
 * @link https://docs.github.com/en/rest/repos/rules#create-a-repository-ruleset
 */
public final class RulesetFields {

    public static final String ID = "id";
    public static final String SOURCE = "source";
    public static final String SOURCE_TYPE = "source_type";
    public static final String NAME = "name";
    public static final String ENFORCEMENT = "enforcement";
    public static final String TARGET = "target";
    public static final String BYPASS_ACTORS = "bypass_actors";
    public static final String CONDITIONS = "conditions";
    public static final String RULES = "rules";

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String LINKS = "_links";
    public static final String LINK = "link";

    public static final String ACTOR_ID = "actor_id";
    public static final String ACTOR_TYPE = "actor_type";
    public static final String ACTOR_NAME = "actor_name";
    public static final String BYPASS_MODE = "bypass_mode";

    public static final String ACTOR_TYPE_TEAM = "Team";
    public static final String ACTOR_TYPE_DEPLOY_KEY = "DeployKey";
    public static final String SOURCE_TYPE_REPOSITORY = "Repository";

    /**
     * The keys sent in create and update requests.
     */
    public static final List<String> WRITE_KEYS = List.of(NAME, ENFORCEMENT, TARGET, BYPASS_ACTORS, CONDITIONS, RULES);

    /**
     * The keys kept by {@link RulesetSanitizer}, also the keys emitted by {@link RulesetEmitter}.
     */
    public static final List<String> KEYS =
            List.of(ID, SOURCE, SOURCE_TYPE, NAME, ENFORCEMENT, TARGET, BYPASS_ACTORS, CONDITIONS, RULES);

    /**
     * {@link #KEYS} plus provenance, emitted in verbose mode.
     */
    public static final List<String> VERBOSE_KEYS = List.of(
            ID, SOURCE, SOURCE_TYPE, NAME, ENFORCEMENT, TARGET, BYPASS_ACTORS, CONDITIONS, RULES, CREATED_AT,
            UPDATED_AT, LINK);

    private RulesetFields() {
        /* prevent instantiation */
    }
}
