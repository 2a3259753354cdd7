package com.example.releaseservice.service;

import com.example.releaseservice.entity.Project;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.CommitteeRepository;
import com.example.releaseservice.repository.ProjectRepository;
import com.example.releaseservice.support.UtcTimestamps;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Project CRUD. Release policy fields are written through {@link PolicyService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Validated
@Transactional(readOnly = true)
public class ProjectService {

    private final ProjectRepository projectRepository;
    private final CommitteeRepository committeeRepository;
    private final StoreMetrics metrics;

    @Transactional
    public Project createProject(@NotBlank @Size(max = 100) String name, @NotBlank String committeeName,
                                 String displayName) {
        log.info("Creating project: name={}, committee={}", name, committeeName);

        if (!committeeRepository.existsById(committeeName)) {
            throw ResourceNotFoundException.committeeNotFound(committeeName);
        }
        if (projectRepository.existsById(name)) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.projectExists(name);
        }

        Project project = Project.builder()
                .name(name)
                .committeeName(committeeName)
                .displayName(displayName)
                .created(UtcTimestamps.now())
                .build();

        try {
            Project saved = projectRepository.saveAndFlush(project);
            log.info("Project created successfully: name={}", saved.getName());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.projectExists(name);
        }
    }

    public Project getProject(String name) {
        return projectRepository.findById(name)
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(name));
    }

    public List<Project> projectsOf(String committeeName) {
        return projectRepository.findByCommitteeNameOrderByNameAsc(committeeName);
    }

    /**
     * Updates descriptive fields; null arguments leave the field unchanged.
     */
    @Transactional
    public Project updateDetails(String name, String displayName, String description,
                                 String category, List<String> programmingLanguages) {
        Project project = getProject(name);
        if (displayName != null) {
            project.setDisplayName(displayName);
        }
        if (description != null) {
            project.setDescription(description);
        }
        if (category != null) {
            project.setCategory(category);
        }
        if (programmingLanguages != null) {
            project.setProgrammingLanguages(new ArrayList<>(programmingLanguages));
        }
        projectRepository.flush();
        log.info("Project updated: name={}", name);
        return project;
    }
}
