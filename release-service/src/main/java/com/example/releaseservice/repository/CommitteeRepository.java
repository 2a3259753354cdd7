package com.example.releaseservice.repository;

import com.example.releaseservice.entity.Committee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CommitteeRepository extends JpaRepository<Committee, String> {

    List<Committee> findByParentNameOrderByNameAsc(String parentName);

    @Query("SELECT c FROM Committee c WHERE :uid MEMBER OF c.committeeMembers ORDER BY c.name")
    List<Committee> findByMember(@Param("uid") String asfUid);

    @Query("SELECT c FROM Committee c WHERE :uid MEMBER OF c.committers ORDER BY c.name")
    List<Committee> findByCommitter(@Param("uid") String asfUid);

    @Query("SELECT c FROM Committee c WHERE :uid MEMBER OF c.committeeMembers " +
            "OR :uid MEMBER OF c.committers ORDER BY c.name")
    List<Committee> findByParticipant(@Param("uid") String asfUid);
}
