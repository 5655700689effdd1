package com.openmarket.verification.domain.repository;

import com.openmarket.verification.domain.model.Business;
import com.openmarket.verification.domain.model.VerificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BusinessRepository extends JpaRepository<Business, UUID> {
    List<Business> findByVerificationStatus(VerificationStatus verificationStatus);
}
