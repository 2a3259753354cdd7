package com.example.releaseservice.entity;

import com.example.releaseservice.support.StringListJsonConverter;
import jakarta.persistence.*;
import lombok.*;

import java.util.List;

/**
 * Per-project overrides of release workflow configuration. Every field is
 * optional; unset fields resolve to documented defaults through
 * {@link com.example.releaseservice.service.PolicyField}.
 */
@Entity
@Table(name = "release_policies")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReleasePolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "mailto_addresses", length = 4000)
    private List<String> mailtoAddresses;

    @Column(name = "manual_vote")
    private Boolean manualVote;

    /**
     * Minimum vote duration in hours. Zero is a valid explicit value.
     */
    @Column(name = "min_hours")
    private Integer minHours;

    @Column(name = "release_checklist", length = 20000)
    private String releaseChecklist;

    @Column(name = "vote_comment_template", length = 20000)
    private String voteCommentTemplate;

    @Column(name = "start_vote_template", length = 20000)
    private String startVoteTemplate;

    @Column(name = "announce_release_template", length = 20000)
    private String announceReleaseTemplate;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "binary_artifact_paths", length = 4000)
    private List<String> binaryArtifactPaths;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "source_artifact_paths", length = 4000)
    private List<String> sourceArtifactPaths;

    @Column(name = "strict_checking")
    private Boolean strictChecking;

    @Column(name = "github_repository_name")
    private String githubRepositoryName;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "github_compose_workflow_path", length = 4000)
    private List<String> githubComposeWorkflowPath;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "github_vote_workflow_path", length = 4000)
    private List<String> githubVoteWorkflowPath;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "github_finish_workflow_path", length = 4000)
    private List<String> githubFinishWorkflowPath;

    @Column(name = "pause_for_rm")
    private Boolean pauseForRm;

    @Column(name = "preserve_download_files")
    private Boolean preserveDownloadFiles;
}
