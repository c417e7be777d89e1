package net.scanward.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanDetails;
import net.scanward.core.model.ScanResult;

import java.time.Instant;
import java.util.List;

/** {@code GET /api/scans/{id}} response: the scan and its results in arrival order. */
public record ScanView(
        @JsonProperty("id") String id,
        @JsonProperty("target") String target,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("results") List<ResultView> results
) {
    public static ScanView of(ScanDetails details) {
        Scan s = details.scan();
        return new ScanView(s.id().toString(), s.target(), s.status().code(),
                s.createdAt(), s.startedAt(), s.completedAt(),
                details.results().stream().map(ResultView::of).toList());
    }

    public record ResultView(
            @JsonProperty("id") Long id,
            @JsonProperty("test_id") String testId,
            @JsonProperty("name") String name,
            @JsonProperty("category") String category,
            @JsonProperty("severity") String severity,
            @JsonProperty("passed") boolean passed,
            @JsonProperty("message") String message,
            @JsonProperty("reference") String reference,
            @JsonProperty("remediation") String remediation,
            @JsonProperty("metadata") @JsonRawValue String metadata
    ) {
        static ResultView of(ScanResult r) {
            return new ResultView(r.id(), r.testId(), r.name(), r.category(), r.severity(), r.passed(),
                    r.message(), r.reference(), r.remediation(), r.metadata());
        }
    }
}
