package dev.contractgate.core.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contractgate.core.conformance.TrendDelta;
import dev.contractgate.core.util.AtomicFileWriter;
import dev.contractgate.core.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Daily snapshots under {@code history/YYYY-MM-DD.yaml}.
 */
public class HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(HistoryStore.class);

    public static final int DEFAULT_RETENTION_DAYS = 90;
    public static final int MIN_RETENTION_DAYS = 7;
    public static final int MAX_RETENTION_DAYS = 365;

    private static final String SUFFIX = ".yaml";

    private final Path directory;
    private final int retentionDays;
    private final Clock clock;
    private final ObjectMapper yaml = Mappers.yaml();

    public HistoryStore(Path directory) {
        this(directory, DEFAULT_RETENTION_DAYS, Clock.systemDefaultZone());
    }

    /**
     * @param retentionDays days to keep, clamped to 7..365
     */
    public HistoryStore(Path directory, int retentionDays, Clock clock) {
        this.directory = directory;
        this.retentionDays = Math.max(MIN_RETENTION_DAYS, Math.min(MAX_RETENTION_DAYS, retentionDays));
        this.clock = clock;
    }

    public void record(HistorySnapshot snapshot) {
        try {
            AtomicFileWriter.write(fileFor(snapshot.date()), yaml.writeValueAsString(snapshot));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize snapshot for " + snapshot.date(), e);
        }
        logger.debug("Recorded history snapshot for {}", snapshot.date());
    }

    public Optional<HistorySnapshot> getSnapshot(LocalDate date) {
        Path file = fileFor(date);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(yaml.readValue(file.toFile(), HistorySnapshot.class));
        } catch (IOException e) {
            logger.warn("Skipping unreadable snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Snapshots between two dates inclusive, oldest first.
     */
    public List<HistorySnapshot> getRange(LocalDate from, LocalDate to) {
        List<HistorySnapshot> snapshots = new ArrayList<>();
        for (LocalDate date : dates()) {
            if (!date.isBefore(from) && !date.isAfter(to)) {
                getSnapshot(date).ifPresent(snapshots::add);
            }
        }
        return snapshots;
    }

    /**
     * The most recent snapshots, newest first.
     */
    public List<HistorySnapshot> getLatest(int count) {
        List<LocalDate> dates = dates();
        List<HistorySnapshot> snapshots = new ArrayList<>();
        for (int i = dates.size() - 1; i >= 0 && snapshots.size() < count; i--) {
            getSnapshot(dates.get(i)).ifPresent(snapshots::add);
        }
        return snapshots;
    }

    /**
     * Delete snapshots older than the retention window.
     *
     * @return the number of snapshots deleted
     */
    public int pruneOldSnapshots() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        int deleted = 0;
        for (LocalDate date : dates()) {
            if (date.isBefore(cutoff)) {
                try {
                    Files.deleteIfExists(fileFor(date));
                    deleted++;
                } catch (IOException e) {
                    logger.warn("Cannot delete snapshot {}: {}", date, e.getMessage());
                }
            }
        }
        if (deleted > 0) {
            logger.info("Pruned {} history snapshots older than {}", deleted, cutoff);
        }
        return deleted;
    }

    /**
     * Change between the oldest and newest snapshot within the last {@code days} days.
     */
    public Optional<TrendDelta> getTrend(int days) {
        LocalDate today = LocalDate.now(clock);
        List<HistorySnapshot> range = getRange(today.minusDays(days), today);
        if (range.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(range.get(range.size() - 1).deltaFrom(range.get(0)));
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    private List<LocalDate> dates() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .forEach(name -> {
                        try {
                            dates.add(LocalDate.parse(name.substring(0, name.length() - SUFFIX.length())));
                        } catch (DateTimeParseException e) {
                            logger.debug("Ignoring non-snapshot file {}", name);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
        dates.sort(Comparator.naturalOrder());
        return dates;
    }

    private Path fileFor(LocalDate date) {
        return directory.resolve(date + SUFFIX);
    }
}
