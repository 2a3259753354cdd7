package com.example.releaseservice.service;

import com.example.releaseservice.entity.Distribution;
import com.example.releaseservice.entity.DistributionPlatform;
import com.example.releaseservice.entity.Release;
import com.example.releaseservice.entity.ReleasePhase;
import com.example.releaseservice.exception.ConstraintViolationException;
import com.example.releaseservice.exception.ResourceNotFoundException;
import com.example.releaseservice.metrics.StoreMetrics;
import com.example.releaseservice.repository.DistributionRepository;
import com.example.releaseservice.repository.ReleaseRepository;
import com.example.releaseservice.support.UtcTimestamps;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Records where a release has been published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Validated
@Transactional(readOnly = true)
public class DistributionService {

    private final DistributionRepository distributionRepository;
    private final ReleaseRepository releaseRepository;
    private final StoreMetrics metrics;

    /**
     * Records a distribution of a preview or published release. The API URL
     * is resolved from the platform's template.
     *
     * @throws IllegalArgumentException when the platform needs an owner namespace or has no staging registry
     */
    @Transactional
    public Distribution recordDistribution(String releaseName, DistributionPlatform platform,
                                           String ownerNamespace, @NotBlank String packageName,
                                           @NotBlank String version, boolean staging) {
        Release release = releaseRepository.findById(releaseName)
                .orElseThrow(() -> ResourceNotFoundException.releaseNotFound(releaseName));
        if (release.getPhase().isBefore(ReleasePhase.RELEASE_PREVIEW)) {
            log.warn("Distribution rejected: release={}, phase={}", releaseName, release.getPhase());
            metrics.recordConstraintViolation();
            throw ConstraintViolationException.notDistributable(releaseName, release.getPhase());
        }

        String namespace = platform.ownerNamespace(ownerNamespace);
        Distribution distribution = Distribution.builder()
                .releaseName(releaseName)
                .platform(platform)
                .ownerNamespace(namespace)
                .packageName(packageName)
                .version(version)
                .staging(staging)
                .apiUrl(platform.apiUrl(namespace, packageName, version, staging))
                .created(UtcTimestamps.now())
                .build();

        try {
            Distribution saved = distributionRepository.saveAndFlush(distribution);
            log.info("Distribution recorded: release={}, platform={}, url={}",
                    releaseName, platform, saved.getApiUrl());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            metrics.recordConstraintViolation();
            log.warn("Distribution rejected by database: release={}, platform={}", releaseName, platform);
            throw ConstraintViolationException.distributionExists(releaseName, platform.value().displayName());
        }
    }

    public List<Distribution> distributionsOf(String releaseName) {
        return distributionRepository.findByReleaseNameOrderByCreatedAsc(releaseName);
    }
}
