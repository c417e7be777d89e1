package net.scanward.adapter.jdbc;

import net.scanward.adapter.jdbc.repo.JdbcScanRepository;
import net.scanward.adapter.jdbc.repo.JdbcScanResultRepository;
import net.scanward.core.model.ResultItem;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcScanResultRepositoryTest extends TestSupport {

    JdbcScanRepository scans;
    JdbcScanResultRepository results;

    @BeforeAll
    void initAll() {
        scans = new JdbcScanRepository();
        results = new JdbcScanResultRepository();
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll();
    }

    UUID seed() throws Exception {
        UUID id = UUID.randomUUID();
        tx.required(() -> { scans.insert(Scan.ofNew(id, "10.0.0.1", Instant.parse("2025-03-01T10:00:00Z"))); return null; });
        return id;
    }

    static ResultItem item(String testId, boolean passed) {
        return new ResultItem(testId, "name-" + testId, "headers", passed ? "info" : "high",
                passed, passed ? null : "missing header", "https://ref.example/" + testId,
                passed ? null : "add the header", "{\"port\":443}");
    }

    @Test
    void repository_has_no_connection_of_its_own() {
        assertThatThrownBy(() -> results.findAllByScan(UUID.randomUUID()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TxContext");
    }

    @Test
    void results_come_back_in_arrival_order_with_all_fields() throws Exception {
        UUID id = seed();
        long first = tx.required(() -> results.insert(ScanResult.of(id, item("t-2", false))));
        long second = tx.required(() -> results.insert(ScanResult.of(id, item("t-1", true))));
        assertThat(second).isGreaterThan(first);

        List<ScanResult> rows = tx.required(() -> results.findAllByScan(id));
        assertThat(rows).extracting(ScanResult::testId).containsExactly("t-2", "t-1");

        ScanResult r = rows.get(0);
        assertThat(r.id()).isEqualTo(first);
        assertThat(r.scanId()).isEqualTo(id);
        assertThat(r.name()).isEqualTo("name-t-2");
        assertThat(r.category()).isEqualTo("headers");
        assertThat(r.severity()).isEqualTo("high");
        assertThat(r.passed()).isFalse();
        assertThat(r.message()).isEqualTo("missing header");
        assertThat(r.reference()).isEqualTo("https://ref.example/t-2");
        assertThat(r.remediation()).isEqualTo("add the header");
        assertThat(r.metadata()).isEqualTo("{\"port\":443}");

        assertThat(rows.get(1).message()).isNull();
    }

    @Test
    void result_for_unknown_scan_is_rejected_by_the_store() {
        assertThatThrownBy(() -> tx.required(() -> results.insert(ScanResult.of(UUID.randomUUID(), item("t", true)))))
                .isInstanceOf(SQLException.class);
    }

    @Test
    void insert_if_absent_keys_on_scan_and_test_id() throws Exception {
        UUID a = seed();
        UUID b = seed();

        boolean first = tx.required(() -> results.insertIfAbsent(ScanResult.of(a, item("t-1", true))));
        boolean again = tx.required(() -> results.insertIfAbsent(ScanResult.of(a, item("t-1", false))));
        boolean otherScan = tx.required(() -> results.insertIfAbsent(ScanResult.of(b, item("t-1", true))));
        assertThat(first).isTrue();
        assertThat(again).isFalse();
        assertThat(otherScan).isTrue();

        List<ScanResult> rows = tx.required(() -> results.findAllByScan(a));
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).passed()).isTrue();
        assertThat(countRows("TB_SCAN_RESULT")).isEqualTo(2);
    }

    @Test
    void no_results_yields_empty_list() throws Exception {
        UUID id = seed();
        List<ScanResult> none = tx.required(() -> results.findAllByScan(id));
        List<ScanResult> unknown = tx.required(() -> results.findAllByScan(UUID.randomUUID()));
        assertThat(none).isEmpty();
        assertThat(unknown).isEmpty();
    }
}
