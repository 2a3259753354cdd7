package com.example.releaseservice.dto;

import lombok.Builder;

import java.util.List;

/**
 * Release policy of a project with every field resolved to its explicit
 * value or default. No component is null.
 */
@Builder
public record EffectivePolicy(
        String projectName,
        List<String> mailtoAddresses,
        boolean manualVote,
        int minHours,
        String releaseChecklist,
        String voteCommentTemplate,
        String startVoteTemplate,
        String announceReleaseTemplate,
        List<String> binaryArtifactPaths,
        List<String> sourceArtifactPaths,
        boolean strictChecking,
        String githubRepositoryName,
        List<String> githubComposeWorkflowPath,
        List<String> githubVoteWorkflowPath,
        List<String> githubFinishWorkflowPath,
        boolean pauseForRm,
        boolean preserveDownloadFiles
) {
}
