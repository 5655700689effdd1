package com.openmarket.verification.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Business profile under admin verification.
 * approvedAt and approvedBy are written together, only by an approval.
 */
@Entity
@Table(name = "business_profiles", indexes = {
        @Index(name = "idx_business_verification_status", columnList = "verification_status"),
        @Index(name = "idx_business_owner_user_id", columnList = "owner_user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Business {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "business_name", nullable = false)
    private String displayName;

    @Column(name = "contact_email")
    private String contactEmail;

    @Column(name = "phone", length = 32)
    private String phone;

    /** User who receives decision notifications; may be absent for imported profiles. */
    @Column(name = "owner_user_id")
    private String ownerUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 20)
    private VerificationStatus verificationStatus;

    @Column(name = "application_submitted_at")
    private LocalDateTime applicationSubmittedAt;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "verification_notes", length = 2000)
    private String verificationNotes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
        if (verificationStatus == null) {
            verificationStatus = VerificationStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
