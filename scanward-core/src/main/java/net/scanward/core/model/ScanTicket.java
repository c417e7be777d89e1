package net.scanward.core.model;

import java.util.UUID;

/** What a submitter gets back once the scan is stored and handed to the queue. */
public record ScanTicket(UUID id, ScanStatus status) {}
