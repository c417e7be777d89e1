package net.scanward.core.service;

import net.scanward.core.error.InvalidStateException;
import net.scanward.core.error.NotFoundException;
import net.scanward.core.error.PersistenceException;
import net.scanward.core.error.ValidationException;
import net.scanward.core.model.IngestOutcome;
import net.scanward.core.model.ResultItem;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanDetails;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.model.ScanTicket;
import net.scanward.core.model.TerminalSubmission;
import net.scanward.core.support.InMemoryScanStore;
import net.scanward.core.support.MutableClock;
import net.scanward.core.support.RecordingWorkQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultIngestServiceTest {

    InMemoryScanStore store;
    MutableClock clock;
    DispatchService dispatch;
    ResultIngestService ingest;
    ScanQueryService query;

    @BeforeEach
    void setUp() {
        store = new InMemoryScanStore();
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        dispatch = new DispatchService(store, new RecordingWorkQueue(), store.tx(), clock, new UuidV7Generator(),
                RetryPolicy.fixed(Duration.ZERO), 1, 0);
        ingest = new ResultIngestService(store, store, store.tx(), clock, true, 3);
        query = new ScanQueryService(store, store, store.tx());
    }

    static ResultItem item(String testId, String severity, boolean passed) {
        return new ResultItem(testId, "check " + testId, "headers", severity, passed,
                "msg", "https://ref.example/" + testId, "fix it", null);
    }

    UUID pendingScan() {
        return dispatch.submit("https://example.com").id();
    }

    @Test
    void first_progress_starts_the_scan() {
        UUID id = pendingScan();
        clock.advance(Duration.ofSeconds(5));

        IngestOutcome out = ingest.recordProgress(id, item("hsts", "high", false));

        assertThat(out.started()).isTrue();
        assertThat(out.resultsInserted()).isEqualTo(1);
        Scan s = store.scan(id);
        assertThat(s.status()).isEqualTo(ScanStatus.RUNNING);
        assertThat(s.startedAt()).isEqualTo(clock.now());
        assertThat(store.resultsOf(id)).hasSize(1);
    }

    @Test
    void later_progress_keeps_started_at() {
        UUID id = pendingScan();
        ingest.recordProgress(id, item("a", "low", true));
        Instant startedAt = store.scan(id).startedAt();
        clock.advance(Duration.ofMinutes(1));

        IngestOutcome out = ingest.recordProgress(id, item("b", "low", true));

        assertThat(out.started()).isFalse();
        assertThat(store.scan(id).startedAt()).isEqualTo(startedAt);
        assertThat(store.resultsOf(id)).extracting("testId").containsExactly("a", "b");
    }

    @Test
    void unknown_scan_is_rejected_without_writes() {
        UUID unknown = new UuidV7Generator().next();

        assertThatThrownBy(() -> ingest.recordProgress(unknown, item("a", "info", true)))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> ingest.finalizeScan(new TerminalSubmission(unknown, ScanStatus.COMPLETED,
                null, null, List.of(item("a", "info", true)))))
                .isInstanceOf(NotFoundException.class);

        assertThat(store.scanCount()).isZero();
        assertThat(store.resultCount()).isZero();
    }

    @Test
    void progress_after_completion_is_invalid_state() {
        UUID id = pendingScan();
        ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null, null, List.of()));

        assertThatThrownBy(() -> ingest.recordProgress(id, item("late", "low", false)))
                .isInstanceOf(InvalidStateException.class);
        assertThat(store.resultsOf(id)).isEmpty();
    }

    @Test
    void repeated_finalize_is_a_no_op() {
        UUID id = pendingScan();
        ingest.recordProgress(id, item("a", "high", false));
        clock.advance(Duration.ofSeconds(30));
        Instant done = clock.now();
        var terminal = new TerminalSubmission(id, ScanStatus.COMPLETED, null, done, List.of(item("b", "low", true)));

        IngestOutcome first = ingest.finalizeScan(terminal);
        clock.advance(Duration.ofMinutes(5));
        IngestOutcome second = ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null,
                clock.now(), List.of(item("b", "low", true))));

        assertThat(first.applied()).isTrue();
        assertThat(first.resultsInserted()).isEqualTo(1);
        assertThat(second.applied()).isFalse();
        assertThat(second.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(store.scan(id).completedAt()).isEqualTo(done);
        assertThat(store.resultsOf(id)).hasSize(2);
    }

    @Test
    void finalize_with_other_terminal_status_does_not_flip_it() {
        UUID id = pendingScan();
        ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.FAILED, null, null, List.of()));

        IngestOutcome out = ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null, null, List.of()));

        assertThat(out.applied()).isFalse();
        assertThat(store.scan(id).status()).isEqualTo(ScanStatus.FAILED);
    }

    @Test
    void pending_scan_can_finalize_directly_with_consistent_timestamps() {
        UUID id = pendingScan();
        Instant started = clock.now().plusSeconds(1);
        Instant completed = clock.now().plusSeconds(9);

        IngestOutcome out = ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, started, completed,
                List.of(item("a", "info", true), item("b", "medium", false))));

        assertThat(out.started()).isTrue();
        Scan s = store.scan(id);
        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.startedAt()).isEqualTo(started);
        assertThat(s.completedAt()).isEqualTo(completed);
        assertThat(store.resultsOf(id)).extracting("testId").containsExactly("a", "b");
    }

    @Test
    void finalize_never_rewrites_started_at() {
        UUID id = pendingScan();
        ingest.recordProgress(id, item("a", "low", true));
        Instant startedAt = store.scan(id).startedAt();

        ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.FAILED, startedAt.plusSeconds(100),
                startedAt.plusSeconds(200), List.of()));

        assertThat(store.scan(id).startedAt()).isEqualTo(startedAt);
    }

    @Test
    void failed_insert_rolls_back_the_transition() {
        UUID id = pendingScan();
        store.failNextResultInsert = new IllegalStateException("disk full");

        assertThatThrownBy(() -> ingest.recordProgress(id, item("a", "low", true)))
                .isInstanceOf(PersistenceException.class);

        Scan s = store.scan(id);
        assertThat(s.status()).isEqualTo(ScanStatus.PENDING);
        assertThat(s.startedAt()).isNull();
        assertThat(store.resultsOf(id)).isEmpty();
    }

    @Test
    void failed_batch_insert_rolls_back_the_finalize() {
        UUID id = pendingScan();
        store.failNextResultInsert = new IllegalStateException("disk full");

        assertThatThrownBy(() -> ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null, null,
                List.of(item("a", "low", true)))))
                .isInstanceOf(PersistenceException.class);

        assertThat(store.scan(id).status()).isEqualTo(ScanStatus.PENDING);
        assertThat(store.scan(id).completedAt()).isNull();
    }

    @Test
    void duplicate_progress_result_is_deduplicated_by_test_id() {
        UUID id = pendingScan();
        ingest.recordProgress(id, item("hsts", "high", false));

        IngestOutcome dup = ingest.recordProgress(id, item("hsts", "high", false));

        assertThat(dup.applied()).isFalse();
        assertThat(store.resultsOf(id)).hasSize(1);
    }

    @Test
    void dedupe_can_be_switched_off() {
        ResultIngestService raw = new ResultIngestService(store, store, store.tx(), clock, false, 0);
        UUID id = pendingScan();
        raw.recordProgress(id, item("hsts", "high", false));
        raw.recordProgress(id, item("hsts", "high", false));

        assertThat(store.resultsOf(id)).hasSize(2);
    }

    @Test
    void malformed_submissions_are_validation_errors() {
        UUID id = pendingScan();
        assertThatThrownBy(() -> ingest.recordProgress(null, item("a", "low", true)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ingest.recordProgress(id, item(" ", "low", true)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.RUNNING, null, null, null)))
                .isInstanceOf(ValidationException.class);
        Instant now = clock.now();
        assertThatThrownBy(() -> ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED,
                now, now.minusSeconds(1), null)))
                .isInstanceOf(ValidationException.class);
        assertThat(store.scan(id).status()).isEqualTo(ScanStatus.PENDING);
    }

    @Test
    void oversized_fields_are_rejected_before_any_write() {
        UUID id = pendingScan();

        assertThatThrownBy(() -> ingest.recordProgress(id, item("t1", "x".repeat(40), false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("severity")
                .satisfies(e -> assertThat(((ValidationException) e).retryable()).isFalse());
        assertThatThrownBy(() -> ingest.recordProgress(id, item("t".repeat(256), "low", false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("test_id");
        ResultItem longName = new ResultItem("t2", "n".repeat(513), "headers", "low", true, null, null, null, null);
        assertThatThrownBy(() -> ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null, null,
                List.of(item("t3", "low", true), longName))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("test_name");

        assertThat(store.scan(id).status()).isEqualTo(ScanStatus.PENDING);
        assertThat(store.resultCount()).isZero();
    }

    @Test
    void concurrent_progress_starts_once_and_keeps_every_result() throws Exception {
        UUID id = pendingScan();
        int n = 16;
        ExecutorService es = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IngestOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String testId = "t" + i;
            futures.add(es.submit(() -> {
                start.await();
                return ingest.recordProgress(id, item(testId, "low", true));
            }));
        }
        start.countDown();

        int starts = 0;
        for (Future<IngestOutcome> f : futures) if (f.get().started()) starts++;
        es.shutdown();

        assertThat(starts).isEqualTo(1);
        assertThat(store.scan(id).status()).isEqualTo(ScanStatus.RUNNING);
        assertThat(store.resultsOf(id)).hasSize(n);
    }

    @Test
    void observed_status_never_moves_backwards() {
        UUID id = pendingScan();
        List<ScanStatus> seen = new ArrayList<>();
        seen.add(store.scan(id).status());

        ingest.recordProgress(id, item("a", "low", true));
        seen.add(store.scan(id).status());
        ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.FAILED, null, null, List.of()));
        seen.add(store.scan(id).status());
        try {
            ingest.recordProgress(id, item("b", "low", true));
        } catch (InvalidStateException expected) {
            // terminal
        }
        seen.add(store.scan(id).status());
        ingest.finalizeScan(new TerminalSubmission(id, ScanStatus.COMPLETED, null, null, List.of()));
        seen.add(store.scan(id).status());

        for (int i = 1; i < seen.size(); i++) {
            ScanStatus prev = seen.get(i - 1), next = seen.get(i);
            assertThat(prev == next || prev.canTransitionTo(next))
                    .as("%s -> %s", prev, next)
                    .isTrue();
        }
        assertThat(seen).containsExactly(ScanStatus.PENDING, ScanStatus.RUNNING, ScanStatus.FAILED,
                ScanStatus.FAILED, ScanStatus.FAILED);
    }

    @Test
    void end_to_end_submit_progress_complete_query() {
        ScanTicket ticket = dispatch.submit("https://example.com");
        assertThat(ticket.status()).isEqualTo(ScanStatus.PENDING);

        ingest.recordProgress(ticket.id(), item("csp", "high", false));
        Scan running = store.scan(ticket.id());
        assertThat(running.status()).isEqualTo(ScanStatus.RUNNING);
        assertThat(running.startedAt()).isNotNull();
        assertThat(store.resultsOf(ticket.id())).hasSize(1);

        ingest.finalizeScan(new TerminalSubmission(ticket.id(), ScanStatus.COMPLETED, null, null, List.of()));

        ScanDetails details = query.get(ticket.id());
        assertThat(details.scan().status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(details.scan().completedAt()).isNotNull();
        assertThat(details.results()).hasSize(1);
        assertThat(details.results().get(0).severity()).isEqualTo("high");
        assertThat(details.results().get(0).passed()).isFalse();
    }
}
