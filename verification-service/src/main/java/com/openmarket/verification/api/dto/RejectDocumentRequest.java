package com.openmarket.verification.api.dto;

public record RejectDocumentRequest(
        String reason,
        String decidedBy
) {
}
