package com.openmarket.verification.api.controller;

import com.openmarket.common.dto.BaseResponse;
import com.openmarket.verification.api.dto.DecisionNotesRequest;
import com.openmarket.verification.api.dto.DocumentDecisionResponse;
import com.openmarket.verification.api.dto.RejectDocumentRequest;
import com.openmarket.verification.api.dto.VerifyDocumentRequest;
import com.openmarket.verification.orchestration.ApprovalOrchestrator;
import com.openmarket.verification.orchestration.DocumentDecisionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/verification/documents")
@RequiredArgsConstructor
public class DocumentVerificationController {

    private final ApprovalOrchestrator approvalOrchestrator;

    @PostMapping("/{id}/verify")
    public ResponseEntity<BaseResponse<DocumentDecisionResponse>> verify(
            @PathVariable UUID id,
            @Valid @RequestBody VerifyDocumentRequest request) {
        return respond("Document verified", approvalOrchestrator.verifyDocument(id, request.verifiedBy()));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<DocumentDecisionResponse>> reject(
            @PathVariable UUID id,
            @RequestBody RejectDocumentRequest request) {
        return respond("Document rejected",
                approvalOrchestrator.rejectDocument(id, request.reason(), request.decidedBy()));
    }

    @PostMapping("/{id}/review")
    public ResponseEntity<BaseResponse<DocumentDecisionResponse>> markUnderReview(
            @PathVariable UUID id,
            @RequestBody(required = false) DecisionNotesRequest request) {
        return respond("Document marked under review",
                approvalOrchestrator.markDocumentUnderReview(id, request != null ? request.decidedBy() : null));
    }

    private static ResponseEntity<BaseResponse<DocumentDecisionResponse>> respond(
            String message, DocumentDecisionResult result) {
        return ResponseEntity.ok(BaseResponse.success(message, DocumentDecisionResponse.from(result), result.warnings()));
    }
}
