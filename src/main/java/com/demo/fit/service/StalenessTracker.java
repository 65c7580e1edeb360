package com.demo.fit.service;

import com.demo.fit.model.RecomputationStatus;
import com.demo.fit.model.StudentProfile;
import com.demo.fit.repository.FitRecordRepository;
import com.demo.fit.repository.InfographicRepository;
import com.demo.fit.repository.StudentProfileRepository;
import com.demo.fit.service.exception.ProfileNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the profile version counter. Records are never invalidated in bulk: a record is stale when its
 * {@code profile_version} differs from the one on file, which is checked whenever it is read or recomputed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StalenessTracker {

    private final StudentProfileRepository profiles;
    private final FitRecordRepository fits;
    private final InfographicRepository infographics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** Stores the new document and returns the bumped version. */
    public long recordProfileChange(String userId, JsonNode document) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document == null ? objectMapper.createObjectNode() : document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Profile document is not serializable", e);
        }
        long version = profiles.recordChange(userId, json, clock.instant());
        log.info("[PROFILE] {} now at version {}", userId, version);
        return version;
    }

    public Optional<StudentProfile> findProfile(String userId) {
        return profiles.find(userId);
    }

    public StudentProfile currentProfile(String userId) {
        return profiles.find(userId).orElseThrow(() -> new ProfileNotFoundException(userId));
    }

    public long currentVersion(String userId) {
        return currentProfile(userId).profileVersion();
    }

    public boolean fitsReady(String userId) {
        return profiles.find(userId).map(StudentProfile::fitsReady).orElse(false);
    }

    public void markFitsComputed(String userId, long profileVersion, Instant at) {
        profiles.markFitsComputed(userId, profileVersion, at);
        log.info("[PROFILE] {} fits computed at {} (version {})", userId, at, profileVersion);
    }

    public RecomputationStatus needsRecomputation(String userId) {
        return needsRecomputation(userId, null);
    }

    /**
     * @param catalogIds universities the matrix should cover; null skips the missing-record check
     */
    public RecomputationStatus needsRecomputation(String userId, Collection<String> catalogIds) {
        Optional<StudentProfile> found = profiles.find(userId);
        if (found.isEmpty()) {
            return new RecomputationStatus(false, "no_profile", 0L, 0, 0);
        }
        StudentProfile profile = found.get();
        long version = profile.profileVersion();
        int stale = fits.countStale(userId, version);
        int missing = 0;
        if (catalogIds != null) {
            Set<String> have = fits.universityIdsForUser(userId);
            missing = (int) UniversityIds.normalizeAll(catalogIds).stream().filter(id -> !have.contains(id)).count();
        }

        if (!profile.fitsReady()) {
            return new RecomputationStatus(true, "never_computed", version, stale, missing);
        }
        if (stale > 0) {
            String reason = Long.valueOf(version).equals(profile.fitsProfileVersion()) ? "stale_records" : "profile_changed";
            return new RecomputationStatus(true, reason, version, stale, missing);
        }
        if (missing > 0) {
            return new RecomputationStatus(true, "missing_records", version, stale, missing);
        }
        return new RecomputationStatus(false, "up_to_date", version, 0, 0);
    }

    /** Deletes the profile, its fit records and infographics. */
    @Transactional
    public void resetProfile(String userId) {
        int records = fits.deleteAllForUser(userId);
        infographics.deleteAllForUser(userId);
        profiles.delete(userId);
        log.info("[PROFILE] {} reset, {} fit records removed", userId, records);
    }
}
