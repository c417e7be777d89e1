package net.scanward.app.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Body of {@code POST /api/results}. A present {@code status} makes it a terminal submission;
 * otherwise the inline test fields are a single progress result.
 */
public record ResultSubmissionRequest(
        @JsonProperty("job_id") @JsonAlias("scan_id") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("results") List<ResultItemRequest> results,

        // progress fields
        @JsonProperty("test_id") String testId,
        @JsonProperty("name") @JsonAlias("test_name") String name,
        @JsonProperty("category") String category,
        @JsonProperty("severity") String severity,
        @JsonProperty("passed") Boolean passed,
        @JsonProperty("threat_level") String threatLevel,
        @JsonProperty("message") String message,
        @JsonProperty("reference") String reference,
        @JsonProperty("remediation") String remediation,
        @JsonProperty("metadata") JsonNode metadata
) {
    public boolean isTerminal() {
        return status != null;
    }

    public ResultItemRequest progressItem() {
        return new ResultItemRequest(testId, name, category, severity, passed, threatLevel,
                message, reference, remediation, metadata);
    }
}
