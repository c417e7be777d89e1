package net.scanward.core.model;

import java.util.List;

public record ScanDetails(Scan scan, List<ScanResult> results) {
    public ScanDetails {
        results = List.copyOf(results);
    }
}
