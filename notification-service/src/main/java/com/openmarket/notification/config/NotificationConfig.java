package com.openmarket.notification.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.DefaultDbRefResolver;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfig {

    /** Stands in for dots in free-form map keys (log metadata), which MongoDB field names cannot hold. */
    static final String MAP_KEY_DOT_REPLACEMENT = "_";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MappingMongoConverter mappingMongoConverter(MongoDatabaseFactory factory, MongoMappingContext context,
                                                       MongoCustomConversions conversions) {
        MappingMongoConverter converter = new MappingMongoConverter(new DefaultDbRefResolver(factory), context);
        converter.setCustomConversions(conversions);
        converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
        return converter;
    }
}
