package com.openmarket.notification.domain.repository;

import com.openmarket.notification.domain.model.NotificationLog;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Append-only: callers use {@code insert}, never {@code save} on an existing row.
 */
public interface NotificationLogRepository extends MongoRepository<NotificationLog, String> {
    List<NotificationLog> findByUserIdOrderByCreatedAtDesc(String userId);
}
