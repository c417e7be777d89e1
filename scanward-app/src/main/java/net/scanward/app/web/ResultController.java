package net.scanward.app.web;

import net.scanward.app.web.dto.ErrorResponse;
import net.scanward.app.web.dto.MessageResponse;
import net.scanward.app.web.dto.ResultItemRequest;
import net.scanward.app.web.dto.ResultSubmissionRequest;
import net.scanward.core.error.NotFoundException;
import net.scanward.core.error.ValidationException;
import net.scanward.core.model.IngestOutcome;
import net.scanward.core.model.ResultItem;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.model.TerminalSubmission;
import net.scanward.core.service.ResultIngestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/** Worker-facing ingestion endpoint. */
@RestController
@RequestMapping("/api/results")
public class ResultController {
    private final ResultIngestService ingest;

    public ResultController(ResultIngestService ingest) {
        this.ingest = ingest;
    }

    @PostMapping
    public MessageResponse submit(@RequestBody(required = false) ResultSubmissionRequest req) {
        if (req == null) throw new ValidationException("request body is required");
        UUID jobId = ScanIds.parse(req.jobId(), "job_id");

        if (!req.isTerminal()) {
            IngestOutcome o = ingest.recordProgress(jobId, req.progressItem().toItem());
            return new MessageResponse(o.resultsInserted() > 0 ? "Result recorded" : "Duplicate result ignored");
        }

        ScanStatus status = parseStatus(req.status());
        List<ResultItem> items = req.results() == null ? List.of()
                : req.results().stream().map(ResultController::toItem).toList();
        IngestOutcome o = ingest.finalizeScan(
                new TerminalSubmission(jobId, status, req.startedAt(), req.completedAt(), items));
        return new MessageResponse(o.applied()
                ? "Results received and scan updated"
                : "Scan already finalized");
    }

    // 결과 라우트에서는 모르는 job_id 도 잘못된 요청으로 본다
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> unknownJob(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("unknown_job", e.getMessage(), false));
    }

    private static ResultItem toItem(ResultItemRequest r) {
        if (r == null) throw new ValidationException("results must not contain null entries");
        return r.toItem();
    }

    private static ScanStatus parseStatus(String raw) {
        try {
            return ScanStatus.from(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("status must be COMPLETED or FAILED");
        }
    }
}
