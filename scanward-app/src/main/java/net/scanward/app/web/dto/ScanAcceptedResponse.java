package net.scanward.app.web.dto;

import net.scanward.core.model.ScanTicket;

public record ScanAcceptedResponse(String scanId, String status) {
    public static ScanAcceptedResponse of(ScanTicket ticket) {
        return new ScanAcceptedResponse(ticket.id().toString(), ticket.status().code());
    }
}
