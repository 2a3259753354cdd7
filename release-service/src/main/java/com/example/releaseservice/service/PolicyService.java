package com.example.releaseservice.service;

import com.example.releaseservice.dto.EffectivePolicy;
import com.example.releaseservice.entity.Project;
import com.example.releaseservice.entity.ReleasePolicy;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reads and writes per-project release policy fields.
 * Reads always resolve through {@link PolicyField#resolve(Project)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PolicyService {

    private final ProjectRepository projectRepository;
    private final StoreMetrics metrics;

    public <T> T resolve(String projectName, PolicyField<T> field) {
        return field.resolve(loadProject(projectName));
    }

    public String startVoteTemplate(String projectName) {
        return resolve(projectName, PolicyField.START_VOTE_TEMPLATE);
    }

    public String announceReleaseTemplate(String projectName) {
        return resolve(projectName, PolicyField.ANNOUNCE_RELEASE_TEMPLATE);
    }

    public String voteCommentTemplate(String projectName) {
        return resolve(projectName, PolicyField.VOTE_COMMENT_TEMPLATE);
    }

    public int minHours(String projectName) {
        return resolve(projectName, PolicyField.MIN_HOURS);
    }

    public List<String> mailtoAddresses(String projectName) {
        return resolve(projectName, PolicyField.MAILTO_ADDRESSES);
    }

    public EffectivePolicy effectivePolicy(String projectName) {
        Project project = loadProject(projectName);
        return EffectivePolicy.builder()
                .projectName(project.getName())
                .mailtoAddresses(List.copyOf(PolicyField.MAILTO_ADDRESSES.resolve(project)))
                .manualVote(PolicyField.MANUAL_VOTE.resolve(project))
                .minHours(PolicyField.MIN_HOURS.resolve(project))
                .releaseChecklist(PolicyField.RELEASE_CHECKLIST.resolve(project))
                .voteCommentTemplate(PolicyField.VOTE_COMMENT_TEMPLATE.resolve(project))
                .startVoteTemplate(PolicyField.START_VOTE_TEMPLATE.resolve(project))
                .announceReleaseTemplate(PolicyField.ANNOUNCE_RELEASE_TEMPLATE.resolve(project))
                .binaryArtifactPaths(List.copyOf(PolicyField.BINARY_ARTIFACT_PATHS.resolve(project)))
                .sourceArtifactPaths(List.copyOf(PolicyField.SOURCE_ARTIFACT_PATHS.resolve(project)))
                .strictChecking(PolicyField.STRICT_CHECKING.resolve(project))
                .githubRepositoryName(PolicyField.GITHUB_REPOSITORY_NAME.resolve(project))
                .githubComposeWorkflowPath(List.copyOf(PolicyField.GITHUB_COMPOSE_WORKFLOW_PATH.resolve(project)))
                .githubVoteWorkflowPath(List.copyOf(PolicyField.GITHUB_VOTE_WORKFLOW_PATH.resolve(project)))
                .githubFinishWorkflowPath(List.copyOf(PolicyField.GITHUB_FINISH_WORKFLOW_PATH.resolve(project)))
                .pauseForRm(PolicyField.PAUSE_FOR_RM.resolve(project))
                .preserveDownloadFiles(PolicyField.PRESERVE_DOWNLOAD_FILES.resolve(project))
                .build();
    }

    /**
     * Writes an explicit value, creating the project's policy on first write.
     */
    @Transactional
    public <T> void set(String projectName, PolicyField<T> field, T value) {
        Project project = loadProject(projectName);
        ReleasePolicy policy = project.getReleasePolicy();
        if (policy == null) {
            policy = new ReleasePolicy();
            project.setReleasePolicy(policy);
            log.info("Release policy created: project={}", projectName);
        }
        field.write(policy, value);
        flush(projectName);
        log.info("Policy field set: project={}, field={}", projectName, field);
    }

    /**
     * Clears an explicit value so that reads fall back to the default.
     */
    @Transactional
    public <T> void unset(String projectName, PolicyField<T> field) {
        Project project = loadProject(projectName);
        if (project.getReleasePolicy() == null) {
            return;
        }
        field.write(project.getReleasePolicy(), null);
        flush(projectName);
        log.info("Policy field unset: project={}, field={}", projectName, field);
    }

    private void flush(String projectName) {
        try {
            projectRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            log.warn("Policy write rejected: project={}, error={}", projectName, ex.getMostSpecificCause().getMessage());
            throw ConstraintViolationException.integrity("release policy of " + projectName, ex);
        }
    }

    private Project loadProject(String projectName) {
        return projectRepository.findById(projectName)
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(projectName));
    }
}
