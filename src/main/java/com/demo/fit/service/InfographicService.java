package com.demo.fit.service;

import com.demo.fit.model.FitRecord;
import com.demo.fit.model.MeteredOperation;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.repository.FitRecordRepository;
import com.demo.fit.repository.InfographicRepository;
import com.demo.fit.repository.UniversityRepository;
import com.demo.fit.service.exception.FitNotComputedException;
import com.demo.fit.service.exception.InsufficientCreditsException;
import com.demo.fit.service.exception.UniversityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Second metered operation on the shared ledger: regenerates the image for an existing fit.
 * Charged only after the generator returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InfographicService {

    private final FitRecordRepository fits;
    private final UniversityRepository universities;
    private final InfographicRepository infographics;
    private final InfographicGenerator generator;
    private final CreditLedger credits;
    private final Clock clock;

    public Regenerated regenerate(String userId, String universityId) {
        String id = UniversityIds.normalize(universityId);
        if (id == null) {
            throw new IllegalArgumentException("university_id is required");
        }
        UniversityRecord university = universities.findById(id).orElseThrow(() -> new UniversityNotFoundException(id));
        FitRecord fit = fits.find(userId, id).orElseThrow(() -> new FitNotComputedException(userId, id));

        int cost = credits.cost(MeteredOperation.INFOGRAPHIC_REGENERATION);
        int balance = credits.balance(userId);
        if (balance < cost) {
            log.warn("[FIT] {} {} infographic refused: {} credits", userId, id, balance);
            throw new InsufficientCreditsException(userId, balance, cost);
        }

        String imageUrl = generator.generate(fit, university);
        int remaining = credits.charge(userId, MeteredOperation.INFOGRAPHIC_REGENERATION);
        Instant now = clock.instant();
        infographics.save(userId, id, imageUrl, now);
        log.info("[FIT] {} {} infographic regenerated, {} credits left", userId, id, remaining);
        return new Regenerated(id, imageUrl, now, remaining);
    }

    public record Regenerated(String universityId, String imageUrl, Instant generatedAt, int creditsRemaining) {}
}
