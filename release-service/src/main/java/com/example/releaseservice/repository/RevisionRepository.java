package com.example.releaseservice.repository;

import com.example.releaseservice.entity.Revision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RevisionRepository extends JpaRepository<Revision, String> {

    List<Revision> findByReleaseNameOrderBySeqAsc(String releaseName);

    Optional<Revision> findByReleaseNameAndNumber(String releaseName, int number);

    Optional<Revision> findFirstByReleaseNameOrderBySeqDesc(String releaseName);

    long countByReleaseName(String releaseName);

    /**
     * Highest sequence number of the release, null when it has no revisions.
     */
    @Query("SELECT MAX(v.seq) FROM Revision v WHERE v.releaseName = :releaseName")
    Integer findMaxSeq(@Param("releaseName") String releaseName);

    /**
     * Latest display number of the release, null when it has no revisions.
     */
    @Query("SELECT MAX(v.number) FROM Revision v WHERE v.releaseName = :releaseName")
    Integer findMaxNumber(@Param("releaseName") String releaseName);
}
