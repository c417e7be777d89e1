package net.scanward.app.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import net.scanward.core.model.ResultItem;
import net.scanward.core.service.ThreatLevels;

/** One check outcome as a worker sends it; {@code passed} may be replaced by {@code threat_level}. */
public record ResultItemRequest(
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
    public ResultItem toItem() {
        boolean ok = ThreatLevels.resolve(passed, threatLevel);
        String sev = severity != null ? severity : threatLevel;
        String meta = metadata == null || metadata.isNull() ? null : metadata.toString();
        return new ResultItem(testId, name, category, sev, ok, message, reference, remediation, meta);
    }
}
