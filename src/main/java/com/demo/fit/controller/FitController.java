package com.demo.fit.controller;

import com.demo.fit.controller.dto.FitDtos.*;
import com.demo.fit.model.BalancedList;
import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitPage;
import com.demo.fit.model.FitQuery;
import com.demo.fit.model.FitResult;
import com.demo.fit.model.FitView;
import com.demo.fit.repository.UniversityRepository;
import com.demo.fit.service.BatchRecomputeScheduler;
import com.demo.fit.service.FitQueryService;
import com.demo.fit.service.InfographicService;
import com.demo.fit.service.SingleFitComputer;
import com.demo.fit.service.StalenessTracker;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.demo.fit.service.exception.FitEngineException;
import com.demo.fit.service.exception.InsufficientCreditsException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/fits")
public class FitController {

    static final String DEGRADED_MESSAGE = "showing cached results, refresh unavailable";

    private final SingleFitComputer computer;
    private final BatchRecomputeScheduler scheduler;
    private final FitQueryService queries;
    private final StalenessTracker staleness;
    private final InfographicService infographics;
    private final UniversityRepository universities;

    /** Cache-first single fit. Falls back to the cached record when a refresh cannot run. */
    @PostMapping(value = "/compute-single-fit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ComputeSingleFitResponse> computeSingleFit(@Valid @RequestBody ComputeSingleFitRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        try {
            FitResult result = computer.computeFit(userId, req.universityId, req.forceRecompute);
            var res = new ComputeSingleFitResponse();
            res.success = true;
            res.fitAnalysis = FitAnalysis.from(result.record(),
                    universities.findById(result.record().universityId()).orElse(null), false);
            res.fromCache = result.fromCache();
            res.creditsRemaining = result.creditsRemaining();
            return ResponseEntity.ok(res);
        } catch (InsufficientCreditsException e) {
            Optional<FitView> cached = queries.findCached(userId, req.universityId);
            if (cached.isEmpty()) throw e;
            var res = degraded(cached.get(), e);
            res.error = e.reasonCode();
            res.creditsRemaining = e.getCreditsRemaining();
            res.creditsNeeded = e.getCreditsNeeded();
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(res);
        } catch (EvaluatorUnavailableException | EvaluatorTimeoutException e) {
            Optional<FitView> cached = queries.findCached(userId, req.universityId);
            if (cached.isEmpty()) throw e;
            var res = degraded(cached.get(), e);
            res.success = true;
            return ResponseEntity.ok(res);
        }
    }

    @PostMapping(value = "/compute-all-fits", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ComputeAllResponse computeAllFits(@Valid @RequestBody ComputeAllRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        return ComputeAllResponse.from(scheduler.recomputeAll(userId, req.universityIds, req.force));
    }

    @PostMapping(value = "/get-fits", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GetFitsResponse getFits(@Valid @RequestBody GetFitsRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        Filters f = req.filters == null ? new Filters() : req.filters;
        FitQuery query;
        try {
            query = new FitQuery(
                    FitCategory.parse(f.category),
                    blankToNull(f.state),
                    f.excludeIds == null ? List.of() : f.excludeIds,
                    req.limit == null ? 0 : req.limit,
                    req.offset == null ? 0 : req.offset,
                    FitQuery.SortBy.parse(req.sortBy));
        } catch (IllegalArgumentException iae) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, iae.getMessage(), iae);
        }
        FitPage page = queries.query(userId, query);

        var res = new GetFitsResponse();
        res.success = true;
        res.results = page.results().stream().map(FitAnalysis::from).toList();
        res.total = page.total();
        res.returned = res.results.size();
        res.fitsReady = page.fitsReady();
        res.softFitFallback = page.softFitFallback();
        Map<String, Object> applied = new LinkedHashMap<>();
        applied.put("category", query.category() == null ? null : query.category().name());
        applied.put("state", query.state());
        applied.put("exclude_ids", query.excludeIds());
        applied.put("sort_by", query.sortBy().name().toLowerCase(Locale.ROOT));
        res.filtersApplied = applied;
        return res;
    }

    @PostMapping(value = "/get-balanced-fits", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BalancedResponse getBalancedFits(@Valid @RequestBody BalancedRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        FitQuery.SortBy sortBy;
        try {
            sortBy = FitQuery.SortBy.parse(req.sortBy);
        } catch (IllegalArgumentException iae) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, iae.getMessage(), iae);
        }
        BalancedList list = queries.getBalancedList(userId, blankToNull(req.state), req.excludeIds, sortBy);

        var res = new BalancedResponse();
        res.success = true;
        res.safety = list.safety().stream().map(FitAnalysis::from).toList();
        res.target = list.target().stream().map(FitAnalysis::from).toList();
        res.reach = list.reach().stream().map(FitAnalysis::from).toList();
        res.results = list.merged().stream().map(FitAnalysis::from).toList();
        res.fitsReady = list.fitsReady();
        return res;
    }

    @GetMapping("/needs-recomputation")
    public NeedsRecomputationResponse needsRecomputation(@RequestParam("user_email") String userEmail) {
        String userId = RequestUsers.userId(userEmail);
        return NeedsRecomputationResponse.from(staleness.needsRecomputation(userId, universities.findAllIds()));
    }

    @PostMapping(value = "/regenerate-infographic", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RegenerateInfographicResponse regenerateInfographic(@Valid @RequestBody RegenerateInfographicRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        var done = infographics.regenerate(userId, req.universityId);
        var res = new RegenerateInfographicResponse();
        res.success = true;
        res.universityId = done.universityId();
        res.imageUrl = done.imageUrl();
        res.generatedAt = done.generatedAt();
        res.creditsRemaining = done.creditsRemaining();
        return res;
    }

    private static ComputeSingleFitResponse degraded(FitView cached, FitEngineException cause) {
        log.warn("[FIT] {} {} degraded to cached record ({})", cached.record().userId(),
                cached.record().universityId(), cause.reasonCode());
        var res = new ComputeSingleFitResponse();
        res.success = false;
        res.fitAnalysis = FitAnalysis.from(cached);
        res.fromCache = true;
        res.degraded = true;
        res.stale = cached.stale();
        res.message = DEGRADED_MESSAGE;
        return res;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
