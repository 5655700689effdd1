package com.openmarket.notification.domain.repository;

import com.openmarket.notification.domain.model.UserNotificationPreference;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface UserNotificationPreferenceRepository extends MongoRepository<UserNotificationPreference, String> {
    Optional<UserNotificationPreference> findByUserId(String userId);
}
