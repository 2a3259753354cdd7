package com.example.releaseservice.repository;

import com.example.releaseservice.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRepository extends JpaRepository<Project, String> {

    List<Project> findByCommitteeNameOrderByNameAsc(String committeeName);

    long countByCommitteeName(String committeeName);
}
