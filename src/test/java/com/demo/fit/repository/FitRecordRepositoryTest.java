package com.demo.fit.repository;

import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitFactor;
import com.demo.fit.model.FitQuery;
import com.demo.fit.model.FitRecord;
import com.demo.fit.model.GapAnalysis;
import com.demo.fit.model.Recommendation;
import com.demo.fit.model.SelectivityTier;
import com.demo.fit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FitRecordRepositoryTest extends IntegrationTestSupport {

    @Autowired
    private FitRecordRepository repository;

    private static FitRecord record(String user, String uni, int pct, FitCategory category, long version,
                                    GapAnalysis gap, List<Recommendation> recs) {
        return new FitRecord(user, uni, pct, category, SelectivityTier.ACCESSIBLE,
                List.of(new FitFactor("GPA Match", pct * 0.4, 40, "")),
                "explanation " + pct, gap, recs, List.of(), List.of(), null,
                null, null, List.of(), List.of(),
                Instant.now().truncatedTo(ChronoUnit.MILLIS), version);
    }

    @Test
    void saveOverwritesEveryField() {
        String user = newUser();
        repository.save(record(user, "purdue", 80, FitCategory.SAFETY, 1,
                new GapAnalysis("Essays", null, List.of("Math")),
                List.of(new Recommendation("Visit campus", "Interest", null, "Spring", "Medium"))));

        FitRecord replacement = record(user, "purdue", 40, FitCategory.REACH, 2, null, List.of());
        repository.save(replacement);

        FitRecord stored = repository.find(user, "purdue").orElseThrow();
        assertEquals(replacement, stored);
        assertNull(stored.gapAnalysis());
        assertThat(stored.recommendations()).isEmpty();
    }

    @Test
    void queryJoinsCatalogAndFilters() {
        String user = newUser();
        repository.save(record(user, "purdue", 80, FitCategory.SAFETY, 1, null, List.of()));
        repository.save(record(user, "uiuc", 90, FitCategory.SAFETY, 1, null, List.of()));
        repository.save(record(user, "penn_state", 60, FitCategory.TARGET, 1, null, List.of()));

        var safety = repository.query(user, FitCategory.SAFETY, List.of(), FitQuery.SortBy.RANK);
        assertThat(safety).extracting(r -> r.record().universityId()).containsExactly("uiuc", "purdue");
        assertEquals("Purdue University", safety.get(1).university().name());
        assertEquals(46, safety.get(1).university().rank());

        var byScore = repository.query(user, null, List.of("uiuc"), FitQuery.SortBy.MATCH_SCORE);
        assertThat(byScore).extracting(r -> r.record().universityId()).containsExactly("purdue", "penn_state");
    }

    @Test
    void countsStaleAndDeletesPerUser() {
        String user = newUser();
        String other = newUser();
        repository.save(record(user, "purdue", 80, FitCategory.SAFETY, 1, null, List.of()));
        repository.save(record(user, "uiuc", 80, FitCategory.SAFETY, 2, null, List.of()));
        repository.save(record(other, "uiuc", 80, FitCategory.SAFETY, 1, null, List.of()));

        assertEquals(1, repository.countStale(user, 2));
        assertEquals(2, repository.deleteAllForUser(user));
        assertThat(repository.findAllForUser(user)).isEmpty();
        assertThat(repository.findAllForUser(other)).hasSize(1);
    }
}
