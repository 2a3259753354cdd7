package com.example.releaseservice.repository;

import com.example.releaseservice.entity.Distribution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DistributionRepository extends JpaRepository<Distribution, Long> {

    List<Distribution> findByReleaseNameOrderByCreatedAsc(String releaseName);
}
