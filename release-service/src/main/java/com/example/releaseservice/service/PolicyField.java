package com.example.releaseservice.service;

import com.example.releaseservice.entity.Project;
import com.example.releaseservice.entity.ReleasePolicy;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * An overridable release policy field together with its default.
 *
 * <p>All fields share one fallback rule: the project's explicit value is used
 * when the project has a policy and the value is set, otherwise the default.
 * A value is unset when it is null, blank text or an empty list.
 *
 * @param <T> value type of the field
 */
public final class PolicyField<T> {

    static final String DEFAULT_START_VOTE_TEMPLATE = """
            Hello [COMMITTEE],

            I would like to call a vote on releasing the following artifacts as
            [PROJECT] [VERSION].

            The release candidate page, including downloads, can be found at:

              [REVIEW_URL]

            The release artifacts are signed with one or more OpenPGP keys from:

              [KEYS_FILE]

            Please review the release candidate and vote accordingly.

            [ ] +1 Release this package
            [ ] +0 Abstain
            [ ] -1 Do not release this package (please provide specific comments)

            You can vote on the release candidate page or by replying to this email.

            The vote is open for [DURATION] hours.

            [RELEASE_CHECKLIST]

            Thanks,
            [YOUR_FULL_NAME] ([YOUR_ASF_ID])
            """;

    static final String DEFAULT_ANNOUNCE_RELEASE_TEMPLATE = """
            The Apache [COMMITTEE] project team is pleased to announce the
            release of [PROJECT] [VERSION].

            The release is available from:

              [DOWNLOAD_URL]

            Thank you for your ongoing support of the [PROJECT] project.

            Regards,
            [YOUR_FULL_NAME] ([YOUR_ASF_ID])
            """;

    static final String DEFAULT_VOTE_COMMENT_TEMPLATE = "";

    static final int DEFAULT_MIN_HOURS = 72;

    public static final PolicyField<List<String>> MAILTO_ADDRESSES = new PolicyField<>(
            "mailtoAddresses",
            ReleasePolicy::getMailtoAddresses, ReleasePolicy::setMailtoAddresses,
            project -> List.of("dev@" + project.getCommitteeName() + ".apache.org"));

    public static final PolicyField<Boolean> MANUAL_VOTE = new PolicyField<>(
            "manualVote",
            ReleasePolicy::getManualVote, ReleasePolicy::setManualVote,
            project -> false);

    public static final PolicyField<Integer> MIN_HOURS = new PolicyField<>(
            "minHours",
            ReleasePolicy::getMinHours, ReleasePolicy::setMinHours,
            project -> DEFAULT_MIN_HOURS);

    public static final PolicyField<String> RELEASE_CHECKLIST = new PolicyField<>(
            "releaseChecklist",
            ReleasePolicy::getReleaseChecklist, ReleasePolicy::setReleaseChecklist,
            project -> "");

    public static final PolicyField<String> VOTE_COMMENT_TEMPLATE = new PolicyField<>(
            "voteCommentTemplate",
            ReleasePolicy::getVoteCommentTemplate, ReleasePolicy::setVoteCommentTemplate,
            project -> DEFAULT_VOTE_COMMENT_TEMPLATE);

    public static final PolicyField<String> START_VOTE_TEMPLATE = new PolicyField<>(
            "startVoteTemplate",
            ReleasePolicy::getStartVoteTemplate, ReleasePolicy::setStartVoteTemplate,
            project -> DEFAULT_START_VOTE_TEMPLATE);

    public static final PolicyField<String> ANNOUNCE_RELEASE_TEMPLATE = new PolicyField<>(
            "announceReleaseTemplate",
            ReleasePolicy::getAnnounceReleaseTemplate, ReleasePolicy::setAnnounceReleaseTemplate,
            project -> DEFAULT_ANNOUNCE_RELEASE_TEMPLATE);

    public static final PolicyField<List<String>> BINARY_ARTIFACT_PATHS = new PolicyField<>(
            "binaryArtifactPaths",
            ReleasePolicy::getBinaryArtifactPaths, ReleasePolicy::setBinaryArtifactPaths,
            project -> List.of());

    public static final PolicyField<List<String>> SOURCE_ARTIFACT_PATHS = new PolicyField<>(
            "sourceArtifactPaths",
            ReleasePolicy::getSourceArtifactPaths, ReleasePolicy::setSourceArtifactPaths,
            project -> List.of());

    public static final PolicyField<Boolean> STRICT_CHECKING = new PolicyField<>(
            "strictChecking",
            ReleasePolicy::getStrictChecking, ReleasePolicy::setStrictChecking,
            project -> false);

    public static final PolicyField<String> GITHUB_REPOSITORY_NAME = new PolicyField<>(
            "githubRepositoryName",
            ReleasePolicy::getGithubRepositoryName, ReleasePolicy::setGithubRepositoryName,
            project -> "");

    public static final PolicyField<List<String>> GITHUB_COMPOSE_WORKFLOW_PATH = new PolicyField<>(
            "githubComposeWorkflowPath",
            ReleasePolicy::getGithubComposeWorkflowPath, ReleasePolicy::setGithubComposeWorkflowPath,
            project -> List.of());

    public static final PolicyField<List<String>> GITHUB_VOTE_WORKFLOW_PATH = new PolicyField<>(
            "githubVoteWorkflowPath",
            ReleasePolicy::getGithubVoteWorkflowPath, ReleasePolicy::setGithubVoteWorkflowPath,
            project -> List.of());

    public static final PolicyField<List<String>> GITHUB_FINISH_WORKFLOW_PATH = new PolicyField<>(
            "githubFinishWorkflowPath",
            ReleasePolicy::getGithubFinishWorkflowPath, ReleasePolicy::setGithubFinishWorkflowPath,
            project -> List.of());

    public static final PolicyField<Boolean> PAUSE_FOR_RM = new PolicyField<>(
            "pauseForRm",
            ReleasePolicy::getPauseForRm, ReleasePolicy::setPauseForRm,
            project -> false);

    public static final PolicyField<Boolean> PRESERVE_DOWNLOAD_FILES = new PolicyField<>(
            "preserveDownloadFiles",
            ReleasePolicy::getPreserveDownloadFiles, ReleasePolicy::setPreserveDownloadFiles,
            project -> false);

    private static final List<PolicyField<?>> ALL = List.of(
            MAILTO_ADDRESSES, MANUAL_VOTE, MIN_HOURS, RELEASE_CHECKLIST,
            VOTE_COMMENT_TEMPLATE, START_VOTE_TEMPLATE, ANNOUNCE_RELEASE_TEMPLATE,
            BINARY_ARTIFACT_PATHS, SOURCE_ARTIFACT_PATHS, STRICT_CHECKING,
            GITHUB_REPOSITORY_NAME, GITHUB_COMPOSE_WORKFLOW_PATH, GITHUB_VOTE_WORKFLOW_PATH,
            GITHUB_FINISH_WORKFLOW_PATH, PAUSE_FOR_RM, PRESERVE_DOWNLOAD_FILES);

    private final String name;
    private final Function<ReleasePolicy, T> reader;
    private final BiConsumer<ReleasePolicy, T> writer;
    private final Function<Project, T> defaultValue;

    private PolicyField(String name,
                        Function<ReleasePolicy, T> reader,
                        BiConsumer<ReleasePolicy, T> writer,
                        Function<Project, T> defaultValue) {
        this.name = name;
        this.reader = reader;
        this.writer = writer;
        this.defaultValue = defaultValue;
    }

    public String name() {
        return name;
    }

    /**
     * Explicit value of the project's policy, empty when there is no policy
     * or the field is unset.
     */
    public Optional<T> explicitValue(Project project) {
        ReleasePolicy policy = project.getReleasePolicy();
        if (policy == null) {
            return Optional.empty();
        }
        T value = reader.apply(policy);
        return isSet(value) ? Optional.of(value) : Optional.empty();
    }

    public T defaultValue(Project project) {
        return defaultValue.apply(project);
    }

    /**
     * Effective value; never null.
     */
    public T resolve(Project project) {
        return explicitValue(project).orElseGet(() -> defaultValue(project));
    }

    void write(ReleasePolicy policy, T value) {
        writer.accept(policy, value);
    }

    public static List<PolicyField<?>> all() {
        return ALL;
    }

    public static Optional<PolicyField<?>> byName(String name) {
        return ALL.stream().filter(field -> field.name.equals(name)).findFirst();
    }

    static boolean isSet(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
