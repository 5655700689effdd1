package com.openmarket.notification.domain.repository;

import com.openmarket.notification.domain.model.NotificationTemplate;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface NotificationTemplateRepository extends MongoRepository<NotificationTemplate, String> {
    Optional<NotificationTemplate> findFirstByTemplateKeyAndActiveTrue(String templateKey);
}
