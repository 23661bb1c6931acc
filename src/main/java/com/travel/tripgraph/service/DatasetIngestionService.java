package com.travel.tripgraph.service;

import com.travel.tripgraph.config.IngestionProperties;
import com.travel.tripgraph.dataset.DatasetSource;
import com.travel.tripgraph.dto.IngestionReport;
import com.travel.tripgraph.dto.NormalizedTrip;
import com.travel.tripgraph.exception.RecordReadException;
import com.travel.tripgraph.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Drives a dataset into the knowledge graph, one transaction per record.
 *
 * Failure policy:
 * - the source or the graph store becoming unreachable aborts the run with {@link SourceUnavailableException}
 * - a record that cannot be read or written is skipped and listed in the report
 * - malformed nested data is recovered by the normalizer and only counted
 *
 * Cancellation is honoured between records; a record already being written runs to completion.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DatasetIngestionService {

    private final TripRecordNormalizer normalizer;
    private final TripGraphWriter writer;
    private final IngestionProperties properties;

    /**
     * Cancel flag of the run in progress, null when idle. Each run gets its own flag,
     * so a cancel() racing with the end of one run never reaches the next.
     */
    private final AtomicReference<AtomicBoolean> activeRun = new AtomicReference<>();

    public IngestionReport ingest(DatasetSource source) {
        return ingest(source, properties.getLimit());
    }

    /**
     * @param limit maximum number of records to take from the source, 0 or less for all
     * @throws IllegalStateException if another run is in progress
     */
    public IngestionReport ingest(DatasetSource source, long limit) {
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        if (!activeRun.compareAndSet(null, cancelRequested)) {
            throw new IllegalStateException("An ingestion run is already in progress");
        }
        long startTime = System.currentTimeMillis();
        RunTally tally = new RunTally();

        log.info("Starting ingestion from {} (limit={}, workers={})",
                source.describe(), limit > 0 ? limit : "none", properties.getWorkerThreads());
        try (Stream<Map<String, Object>> records = source.open()) {
            Iterator<Map<String, Object>> iterator = records.iterator();
            if (properties.getWorkerThreads() > 1) {
                ingestParallel(iterator, limit, tally, cancelRequested);
            } else {
                ingestSequential(iterator, limit, tally, cancelRequested);
            }
        } finally {
            activeRun.set(null);
        }

        IngestionReport report = tally.toReport(source.describe(),
                cancelRequested.get() ? IngestionReport.Outcome.CANCELLED : IngestionReport.Outcome.COMPLETED,
                System.currentTimeMillis() - startTime);
        log.info("Ingestion {} from {}: {} processed, {} written, {} skipped, {} malformed in {}ms",
                report.getOutcome(), report.getSource(), report.getProcessed(), report.getWritten(),
                report.getSkipped().size(), report.getMalformed(), report.getDurationMs());
        return report;
    }

    /**
     * Ask the current run to stop before its next record
     *
     * @return false when no run is in progress
     */
    public boolean cancel() {
        AtomicBoolean cancelRequested = activeRun.get();
        if (cancelRequested == null) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Ingestion cancellation requested");
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    private void ingestSequential(Iterator<Map<String, Object>> iterator, long limit, RunTally tally,
                                  AtomicBoolean cancelRequested) {
        long index = 0;
        while (!cancelRequested.get() && (limit <= 0 || index < limit)) {
            Map<String, Object> record;
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                record = iterator.next();
            } catch (RecordReadException e) {
                tally.skipUnread(index++, e.getMessage());
                continue;
            } catch (UncheckedIOException e) {
                throw new SourceUnavailableException("Dataset read failed: " + e.getMessage(), e);
            }
            ingestRecord(index++, record, tally);
        }
    }

    private void ingestParallel(Iterator<Map<String, Object>> iterator, long limit, RunTally tally,
                                AtomicBoolean cancelRequested) {
        int workers = properties.getWorkerThreads();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        Semaphore inFlight = new Semaphore(workers * 2);
        AtomicReference<SourceUnavailableException> fatal = new AtomicReference<>();
        try {
            long index = 0;
            while (!cancelRequested.get() && fatal.get() == null && (limit <= 0 || index < limit)) {
                Map<String, Object> record;
                try {
                    if (!iterator.hasNext()) {
                        break;
                    }
                    record = iterator.next();
                } catch (RecordReadException e) {
                    tally.skipUnread(index++, e.getMessage());
                    continue;
                } catch (UncheckedIOException e) {
                    throw new SourceUnavailableException("Dataset read failed: " + e.getMessage(), e);
                }

                long recordIndex = index++;
                inFlight.acquireUninterruptibly();
                pool.execute(() -> {
                    try {
                        if (!cancelRequested.get() && fatal.get() == null) {
                            ingestRecord(recordIndex, record, tally);
                        }
                    } catch (SourceUnavailableException e) {
                        fatal.compareAndSet(null, e);
                    } finally {
                        inFlight.release();
                    }
                });
            }
        } finally {
            pool.shutdown();
            awaitWorkers(pool);
        }
        if (fatal.get() != null) {
            throw fatal.get();
        }
    }

    private void awaitWorkers(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.info("Waiting for in-flight record transactions to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for ingestion workers", e);
        }
    }

    private void ingestRecord(long index, Map<String, Object> record, RunTally tally) {
        tally.processed.incrementAndGet();
        NormalizedTrip trip = normalizer.normalize(record);
        if (trip.isMalformed()) {
            tally.malformed.incrementAndGet();
            log.warn("Record {} ({} -> {}) has malformed data, continuing with defaults: {}",
                    index, trip.getOrigin(), trip.getDestination(), trip.getIssues());
        }

        try {
            writer.write(trip);
            int written = tally.written.incrementAndGet();
            if (properties.getProgressLogInterval() > 0 && written % properties.getProgressLogInterval() == 0) {
                log.info("Ingested {} records", written);
            }
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException
                 | ServiceUnavailableException e) {
            throw new SourceUnavailableException("Graph store unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("Skipping record {} ({} -> {}): write rolled back: {}",
                    index, trip.getOrigin(), trip.getDestination(), e.getMessage());
            tally.skip(index, e.getMessage());
        }
    }

    /**
     * Counters shared by the workers of one run
     */
    private static final class RunTally {
        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger written = new AtomicInteger();
        private final AtomicInteger malformed = new AtomicInteger();
        private final List<IngestionReport.SkippedRecord> skipped = new ArrayList<>();

        // a record the source could not read still counts as processed
        void skipUnread(long index, String reason) {
            processed.incrementAndGet();
            skip(index, reason);
        }

        synchronized void skip(long index, String reason) {
            skipped.add(IngestionReport.SkippedRecord.builder()
                    .index(index)
                    .reason(reason)
                    .build());
        }

        synchronized IngestionReport toReport(String source, IngestionReport.Outcome outcome, long durationMs) {
            List<IngestionReport.SkippedRecord> ordered = new ArrayList<>(skipped);
            ordered.sort((a, b) -> Long.compare(a.getIndex(), b.getIndex()));
            return IngestionReport.builder()
                    .source(source)
                    .outcome(outcome)
                    .processed(processed.get())
                    .written(written.get())
                    .malformed(malformed.get())
                    .skipped(ordered)
                    .durationMs(durationMs)
                    .build();
        }
    }
}
