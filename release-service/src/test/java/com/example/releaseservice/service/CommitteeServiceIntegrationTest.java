package com.example.releaseservice.service;

import com.example.releaseservice.StoreIntegrationTestBase;
import com.example.releaseservice.entity.Committee;
import com.example.releaseservice.entity.Project;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitteeServiceIntegrationTest extends StoreIntegrationTestBase {

    @Test
    void testCreatePodling_ParentLinkAndChildrenQuery() {
        committeeService.createCommittee("incubator", "Incubator", null);
        committeeService.createCommittee("nifi-minifi", "MiNiFi", "incubator");

        assertThat(committeeService.getCommittee("nifi-minifi").isPodling()).isTrue();
        assertThat(committeeService.getCommittee("incubator").isPodling()).isFalse();
        assertThat(committeeService.childrenOf("incubator"))
                .extracting(Committee::getName)
                .containsExactly("nifi-minifi");
    }

    @Test
    void testCreateCommittee_Duplicate_Rejected() {
        committeeService.createCommittee("tooling", "Tooling", null);

        assertThatThrownBy(() -> committeeService.createCommittee("tooling", "Other", null))
                .isInstanceOf(ConstraintViolationException.class)
                .extracting("code").isEqualTo("COMMITTEE_ALREADY_EXISTS");
        assertThat(committeeService.getCommittee("tooling").getFullName()).isEqualTo("Tooling");
    }

    @Test
    void testSetParent_WouldCreateCycle_Rejected() {
        committeeService.createCommittee("a", null, null);
        committeeService.createCommittee("b", null, "a");
        committeeService.createCommittee("c", null, "b");

        assertThatThrownBy(() -> committeeService.setParent("a", "c"))
                .isInstanceOf(ConstraintViolationException.class)
                .extracting("code").isEqualTo("COMMITTEE_CYCLE");
        assertThatThrownBy(() -> committeeService.setParent("a", "a"))
                .isInstanceOf(ConstraintViolationException.class);
        assertThat(committeeService.getCommittee("a").getParentName()).isNull();
    }

    @Test
    void testCreateCommittee_UnknownParent_NotFound() {
        assertThatThrownBy(() -> committeeService.createCommittee("orphan", null, "nowhere"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testMembershipQueries_MemberCommitterParticipant() {
        committeeService.createCommittee("tooling", "Tooling", null);
        committeeService.createCommittee("httpd", "HTTP Server", null);
        committeeService.updateMembership("tooling", List.of("alice", "bob", "alice"), List.of("alice", "bob", "carol"));
        committeeService.updateMembership("httpd", List.of("dave"), List.of("carol"));

        Committee tooling = committeeService.getCommittee("tooling");
        assertThat(tooling.getCommitteeMembers()).containsExactly("alice", "bob");
        assertThat(tooling.isMember("carol")).isFalse();
        assertThat(tooling.isParticipant("carol")).isTrue();

        assertThat(committeeService.committeesByMember("alice")).extracting(Committee::getName).containsExactly("tooling");
        assertThat(committeeService.committeesByCommitter("carol"))
                .extracting(Committee::getName)
                .containsExactly("httpd", "tooling");
        assertThat(committeeService.committeesByParticipant("dave")).extracting(Committee::getName).containsExactly("httpd");
        assertThat(committeeService.committeesByParticipant("nobody")).isEmpty();
    }

    @Test
    void testDeleteCommittee_StillOwnsProjects_Rejected() {
        givenProject();

        assertThatThrownBy(() -> committeeService.deleteCommittee(COMMITTEE))
                .isInstanceOf(ConstraintViolationException.class)
                .extracting("code").isEqualTo("COMMITTEE_IN_USE");
        assertThat(committeeService.getCommittee(COMMITTEE)).isNotNull();
    }

    @Test
    void testDeleteCommittee_Unused_RemovedWithMembership() {
        committeeService.createCommittee("retired", null, null);
        committeeService.updateMembership("retired", List.of("alice"), List.of("alice"));

        committeeService.deleteCommittee("retired");

        assertThatThrownBy(() -> committeeService.getCommittee("retired"))
                .isInstanceOf(ResourceNotFoundException.class);
        Integer members = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM committee_members", Integer.class);
        assertThat(members).isZero();
    }

    @Test
    void testProjects_ListedByCommitteeAndUpdated() {
        givenProject();
        projectService.createProject("tooling-actions", COMMITTEE, null);

        Project updated = projectService.updateDetails(PROJECT, null, "Release platform", "tooling", List.of("Python", "Java"));

        assertThat(projectService.projectsOf(COMMITTEE))
                .extracting(Project::getName)
                .containsExactly("tooling-actions", PROJECT);
        assertThat(updated.getDisplayName()).isEqualTo("Apache Trusted Release");
        assertThat(projectService.getProject(PROJECT).getProgrammingLanguages()).containsExactly("Python", "Java");
        assertThat(projectService.getProject("tooling-actions").effectiveDisplayName()).isEqualTo("tooling-actions");
    }

    @Test
    void testCreateProject_UnknownCommittee_NotFound() {
        assertThatThrownBy(() -> projectService.createProject("stray", "nowhere", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
