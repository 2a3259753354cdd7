package com.example.releaseservice.service;

import com.example.releaseservice.entity.Committee;
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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Committee CRUD and membership queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Validated
@Transactional(readOnly = true)
public class CommitteeService {

    private final CommitteeRepository committeeRepository;
    private final ProjectRepository projectRepository;
    private final StoreMetrics metrics;

    @Transactional
    public Committee createCommittee(@NotBlank @Size(max = 100) String name, String fullName, String parentName) {
        log.info("Creating committee: name={}, parent={}", name, parentName);

        if (committeeRepository.existsById(name)) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.committeeExists(name);
        }
        if (parentName != null) {
            requireAcyclic(name, parentName);
        }

        Committee committee = Committee.builder()
                .name(name)
                .fullName(fullName)
                .parentName(parentName)
                .created(UtcTimestamps.now())
                .build();

        try {
            Committee saved = committeeRepository.saveAndFlush(committee);
            log.info("Committee created successfully: name={}", saved.getName());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.committeeExists(name);
        }
    }

    public Committee getCommittee(String name) {
        return committeeRepository.findById(name)
                .orElseThrow(() -> ResourceNotFoundException.committeeNotFound(name));
    }

    public List<Committee> childrenOf(String parentName) {
        return committeeRepository.findByParentNameOrderByNameAsc(parentName);
    }

    /**
     * @param parentName new parent, null to detach
     * @throws ConstraintViolationException when the committee would become its own ancestor
     */
    @Transactional
    public Committee setParent(String name, String parentName) {
        Committee committee = getCommittee(name);
        if (parentName != null) {
            requireAcyclic(name, parentName);
        }
        committee.setParentName(parentName);
        committeeRepository.flush();
        log.info("Committee parent changed: name={}, parent={}", name, parentName);
        return committee;
    }

    /**
     * Replaces both membership lists.
     */
    @Transactional
    public Committee updateMembership(String name, List<String> committeeMembers, List<String> committers) {
        Committee committee = getCommittee(name);
        committee.getCommitteeMembers().clear();
        committee.getCommitteeMembers().addAll(distinct(committeeMembers));
        committee.getCommitters().clear();
        committee.getCommitters().addAll(distinct(committers));
        committeeRepository.flush();
        log.info("Committee membership updated: name={}, members={}, committers={}",
                name, committee.getCommitteeMembers().size(), committee.getCommitters().size());
        return committee;
    }

    public List<Committee> committeesByMember(String asfUid) {
        return committeeRepository.findByMember(asfUid);
    }

    public List<Committee> committeesByCommitter(String asfUid) {
        return committeeRepository.findByCommitter(asfUid);
    }

    /**
     * Committees where the user is a member or a committer.
     */
    public List<Committee> committeesByParticipant(String asfUid) {
        return committeeRepository.findByParticipant(asfUid);
    }

    /**
     * @throws ConstraintViolationException while projects reference the committee
     */
    @Transactional
    public void deleteCommittee(String name) {
        Committee committee = getCommittee(name);
        long projects = projectRepository.countByCommitteeName(name);
        if (projects > 0) {
            metrics.recordConstraintViolation();
            log.warn("Committee delete rejected: name={}, projects={}", name, projects);
            throw ConstraintViolationException.committeeInUse(name, projects);
        }
        try {
            committeeRepository.delete(committee);
            committeeRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.integrity("committee " + name, ex);
        }
        log.info("Committee deleted: name={}", name);
    }

    /**
     * Walks up from the proposed parent; reaching {@code name} means a cycle.
     */
    private void requireAcyclic(String name, String parentName) {
        Set<String> visited = new HashSet<>();
        String current = parentName;
        while (current != null) {
            if (current.equals(name) || !visited.add(current)) {
                metrics.recordConstraintViolation();
                log.warn("Committee parent rejected: name={}, parent={}", name, parentName);
                throw ConstraintViolationException.committeeCycle(name, parentName);
            }
            final String lookup = current;
            current = committeeRepository.findById(lookup)
                    .orElseThrow(() -> ResourceNotFoundException.committeeNotFound(lookup))
                    .getParentName();
        }
    }

    private static List<String> distinct(List<String> uids) {
        return uids == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(uids));
    }
}
