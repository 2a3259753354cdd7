package com.example.releaseservice.repository;

import com.example.releaseservice.dto.ReleaseSummary;
import com.example.releaseservice.entity.Release;
import com.example.releaseservice.entity.ReleasePhase;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReleaseRepository extends JpaRepository<Release, String> {

    Optional<Release> findByProjectNameAndVersion(String projectName, String version);

    boolean existsByProjectNameAndVersion(String projectName, String version);

    List<Release> findByProjectName(String projectName);

    List<Release> findByProjectNameAndPhaseOrderByCreatedDesc(String projectName, ReleasePhase phase);

    List<Release> findByProjectNameAndPhaseInOrderByCreatedDesc(String projectName, Collection<ReleasePhase> phases);

    /**
     * Loads the release and takes a row lock held until the transaction ends.
     * Every writer that depends on the release's phase or its revision
     * sequence goes through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Release r WHERE r.name = :name")
    Optional<Release> findByNameForUpdate(@Param("name") String name);

    /**
     * Releases of a project with their latest revision number, computed by a
     * correlated subquery in the same statement.
     */
    @Query("SELECT new com.example.releaseservice.dto.ReleaseSummary(" +
            "r.name, r.projectName, r.version, r.phase, r.created, " +
            "(SELECT MAX(v.number) FROM Revision v WHERE v.releaseName = r.name)) " +
            "FROM Release r WHERE r.projectName = :projectName ORDER BY r.created DESC")
    List<ReleaseSummary> findSummariesByProjectName(@Param("projectName") String projectName);
}
