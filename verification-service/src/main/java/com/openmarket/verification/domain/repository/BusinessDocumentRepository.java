package com.openmarket.verification.domain.repository;

import com.openmarket.verification.domain.model.BusinessDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface BusinessDocumentRepository extends JpaRepository<BusinessDocument, UUID> {
    List<BusinessDocument> findByBusinessId(UUID businessId);

    /** Batch load for the review queue, avoids one query per business. */
    List<BusinessDocument> findByBusinessIdIn(Collection<UUID> businessIds);
}
