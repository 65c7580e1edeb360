package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.BalancedList;
import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitPage;
import com.demo.fit.model.FitQuery;
import com.demo.fit.model.FitView;
import com.demo.fit.model.StudentProfile;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.repository.FitRecordRepository;
import com.demo.fit.repository.UniversityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Read side of the fit matrix. Never calls the evaluator and never charges.
 */
@Slf4j
@Service
public class FitQueryService {

    private final FitRecordRepository fits;
    private final UniversityRepository universities;
    private final StalenessTracker staleness;
    private final FitScorer scorer;
    private final ExecutorService executor;
    private final FitEngineProperties.Query config;

    public FitQueryService(FitRecordRepository fits,
                           UniversityRepository universities,
                           StalenessTracker staleness,
                           FitScorer scorer,
                           @Qualifier("fitQueryExecutor") ExecutorService executor,
                           FitEngineProperties properties) {
        this.fits = fits;
        this.universities = universities;
        this.staleness = staleness;
        this.scorer = scorer;
        this.executor = executor;
        this.config = properties.query();
    }

    public FitPage query(String userId, FitQuery q) {
        Optional<StudentProfile> profile = staleness.findProfile(userId);
        boolean ready = profile.map(StudentProfile::fitsReady).orElse(false);
        long version = profile.map(StudentProfile::profileVersion).orElse(-1L);
        int limit = clampLimit(q.limit());
        int offset = Math.max(0, q.offset());
        List<String> excluded = UniversityIds.normalizeAll(q.excludeIds());

        List<FitView> matched = fits.query(userId, q.category(), excluded, q.sortBy()).stream()
                .filter(row -> q.state() == null
                        || (row.university() != null && StateNames.matches(q.state(), row.university().state())))
                .map(row -> new FitView(row.record(), row.university(), row.record().fitCategory(),
                        profile.isPresent() && row.record().staleAgainst(version), false))
                .toList();

        if (matched.isEmpty() && q.category() != null && !ready) {
            List<FitView> soft = softFits(q.category(), q.state(), excluded);
            log.info("[QUERY] {} {} matrix not ready, {} soft fits", userId, q.category(), soft.size());
            return new FitPage(page(soft, offset, limit), soft.size(), false, true);
        }

        log.debug("[QUERY] {} category={} state={} -> {}", userId, q.category(), q.state(), matched.size());
        return new FitPage(page(matched, offset, limit), matched.size(), ready, false);
    }

    /**
     * SAFETY, TARGET and REACH lists fetched in parallel with their fixed sub-limits.
     */
    public BalancedList getBalancedList(String userId, String state, List<String> excludeIds, FitQuery.SortBy sortBy) {
        var base = new FitQuery(null, state, excludeIds, 0, 0, sortBy == null ? FitQuery.SortBy.RANK : sortBy);
        var balanced = config.balanced();

        CompletableFuture<FitPage> safety = async(userId, base.withCategory(FitCategory.SAFETY, balanced.safety()));
        CompletableFuture<FitPage> target = async(userId, base.withCategory(FitCategory.TARGET, balanced.target()));
        CompletableFuture<FitPage> reach = async(userId, base.withCategory(FitCategory.REACH, balanced.reach()));
        try {
            CompletableFuture.allOf(safety, target, reach).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
        boolean ready = safety.join().fitsReady() || target.join().fitsReady() || reach.join().fitsReady()
                || staleness.fitsReady(userId);
        return new BalancedList(safety.join().results(), target.join().results(), reach.join().results(), ready);
    }

    /** The cached record for one pair, with its stale flag. */
    public Optional<FitView> findCached(String userId, String universityId) {
        String id = UniversityIds.normalize(universityId);
        if (id == null) return Optional.empty();
        long version = staleness.findProfile(userId).map(StudentProfile::profileVersion).orElse(-1L);
        return fits.find(userId, id).map(r -> FitView.of(r,
                universities.findById(id).orElse(null),
                version >= 0 && r.staleAgainst(version)));
    }

    private CompletableFuture<FitPage> async(String userId, FitQuery q) {
        return CompletableFuture.supplyAsync(() -> query(userId, q), executor);
    }

    private List<FitView> softFits(FitCategory category, String state, List<String> excluded) {
        Set<String> skip = new HashSet<>(excluded);
        return universities.findAll().stream()
                .filter(u -> !skip.contains(u.universityId()))
                .filter(u -> StateNames.matches(state, u.state()))
                .filter(u -> scorer.softCategory(u.acceptanceRate()) == category)
                .map(u -> FitView.soft(u, category))
                .toList();
    }

    private int clampLimit(int requested) {
        int limit = requested <= 0 ? config.defaultLimit() : requested;
        return Math.min(limit, config.maxLimit());
    }

    private static <T> List<T> page(List<T> all, int offset, int limit) {
        if (offset >= all.size()) return List.of();
        return all.subList(offset, Math.min(all.size(), offset + limit));
    }
}
