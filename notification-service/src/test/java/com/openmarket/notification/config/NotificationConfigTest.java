package com.openmarket.notification.config;

import com.openmarket.notification.domain.model.NotificationLog;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class NotificationConfigTest {

    @Test
    @DisplayName("dotted metadata keys are written with the replacement instead of being rejected")
    void mappingMongoConverter_escapesDottedMapKeys() {
        MongoCustomConversions conversions = new MongoCustomConversions(List.of());
        MongoMappingContext context = new MongoMappingContext();
        context.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        context.afterPropertiesSet();

        MappingMongoConverter converter = new NotificationConfig()
                .mappingMongoConverter(mock(MongoDatabaseFactory.class), context, conversions);
        converter.afterPropertiesSet();

        NotificationLog entry = NotificationLog.builder()
                .userId("user-42")
                .metadata(Map.of("booking.id", "1"))
                .build();
        Document document = new Document();
        converter.write(entry, document);

        assertThat(document.get("metadata", Document.class))
                .containsEntry("booking_id", "1")
                .doesNotContainKey("booking.id");
    }
}
