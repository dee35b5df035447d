package dev.contractgate.core.history;

import dev.contractgate.core.MutableClock;
import dev.contractgate.core.conformance.ConformanceSummary;
import dev.contractgate.core.conformance.TrendDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HistoryStoreTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private HistoryStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        store = new HistoryStore(dir.resolve("history"), 30, clock);
    }

    @Test
    void snapshotsRoundTripThroughDailyFiles() {
        store.record(snapshot("2026-03-10", 8, 2));

        assertThat(dir.resolve("history/2026-03-10.yaml")).exists();
        HistorySnapshot loaded = store.getSnapshot(LocalDate.parse("2026-03-10")).orElseThrow();
        assertThat(loaded.summary()).isEqualTo(ConformanceSummary.of(8, 2, 0, 0));
        assertThat(loaded.bySeverity()).containsEntry("error", 2);
        assertThat(loaded.runId()).isEqualTo("run-2026-03-10");
        assertThat(store.getSnapshot(LocalDate.parse("2026-03-09"))).isEmpty();
    }

    @Test
    void laterRunOnTheSameDayReplacesTheSnapshot() {
        store.record(snapshot("2026-03-10", 8, 2));
        store.record(snapshot("2026-03-10", 9, 1));

        assertThat(store.getLatest(5)).singleElement()
                .extracting(s -> s.summary().failed()).isEqualTo(1);
    }

    @Test
    void rangeIsInclusiveAndLatestIsNewestFirst() {
        store.record(snapshot("2026-03-01", 5, 5));
        store.record(snapshot("2026-03-05", 6, 4));
        store.record(snapshot("2026-03-09", 7, 3));

        assertThat(store.getRange(LocalDate.parse("2026-03-01"), LocalDate.parse("2026-03-05")))
                .extracting(HistorySnapshot::date)
                .containsExactly(LocalDate.parse("2026-03-01"), LocalDate.parse("2026-03-05"));
        assertThat(store.getLatest(2))
                .extracting(HistorySnapshot::date)
                .containsExactly(LocalDate.parse("2026-03-09"), LocalDate.parse("2026-03-05"));
    }

    @Test
    void trendComparesOldestAndNewestInWindow() {
        store.record(snapshot("2026-02-01", 1, 9));
        store.record(snapshot("2026-03-04", 5, 5));
        store.record(snapshot("2026-03-10", 8, 2));

        TrendDelta trend = store.getTrend(7).orElseThrow();

        assertThat(trend.failed()).isEqualTo(-3);
        assertThat(trend.passed()).isEqualTo(3);
        assertThat(trend.complianceRate()).isCloseTo(0.3, within(1e-9));
        assertThat(trend.isImproving()).isTrue();
        assertThat(store.getTrend(1)).isEmpty();
    }

    @Test
    void pruneRemovesSnapshotsOutsideRetention() throws IOException {
        store.record(snapshot("2026-01-01", 1, 1));
        store.record(snapshot("2026-02-07", 1, 1));
        store.record(snapshot("2026-02-08", 1, 1));
        Files.writeString(dir.resolve("history/notes.yaml"), "not a snapshot");

        assertThat(store.pruneOldSnapshots()).isEqualTo(2);
        assertThat(store.getLatest(10)).extracting(HistorySnapshot::date)
                .containsExactly(LocalDate.parse("2026-02-08"));
        assertThat(dir.resolve("history/notes.yaml")).exists();
    }

    @Test
    void retentionIsClamped() {
        assertThat(new HistoryStore(dir, 1, clock).getRetentionDays()).isEqualTo(HistoryStore.MIN_RETENTION_DAYS);
        assertThat(new HistoryStore(dir, 1000, clock).getRetentionDays()).isEqualTo(HistoryStore.MAX_RETENTION_DAYS);
        assertThat(new HistoryStore(dir).getRetentionDays()).isEqualTo(HistoryStore.DEFAULT_RETENTION_DAYS);
    }

    @Test
    void unreadableSnapshotsAreSkipped() throws IOException {
        Files.createDirectories(dir.resolve("history"));
        Files.writeString(dir.resolve("history/2026-03-08.yaml"), "summary: [not, a, mapping");
        store.record(snapshot("2026-03-09", 3, 0));

        assertThat(store.getLatest(5)).extracting(HistorySnapshot::date)
                .containsExactly(LocalDate.parse("2026-03-09"));
    }

    private HistorySnapshot snapshot(String date, int passed, int failed) {
        return new HistorySnapshot(LocalDate.parse(date), clock.instant(), "run-" + date,
                ConformanceSummary.of(passed, failed, 0, 0),
                Map.of("error", failed), Map.of("team", failed));
    }
}
