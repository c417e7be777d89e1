package net.scanward.app.web;

import net.scanward.app.web.dto.CreateScanRequest;
import net.scanward.app.web.dto.ScanAcceptedResponse;
import net.scanward.app.web.dto.ScanView;
import net.scanward.core.error.ValidationException;
import net.scanward.core.service.DispatchService;
import net.scanward.core.service.ScanQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scans")
public class ScanController {
    private final DispatchService dispatch;
    private final ScanQueryService query;

    public ScanController(DispatchService dispatch, ScanQueryService query) {
        this.dispatch = dispatch;
        this.query = query;
    }

    @PostMapping
    public ResponseEntity<ScanAcceptedResponse> submit(@RequestBody(required = false) CreateScanRequest req) {
        if (req == null) throw new ValidationException("target is required");
        return ResponseEntity.accepted().body(ScanAcceptedResponse.of(dispatch.submit(req.target())));
    }

    @GetMapping("/{id}")
    public ScanView get(@PathVariable("id") String id) {
        return ScanView.of(query.get(ScanIds.parse(id, "scan id")));
    }
}
