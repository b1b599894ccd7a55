package com.campusagent.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * Enables created/updated timestamps on catalog entries and query logs.
 */
@Configuration
@EnableMongoAuditing
public class MongoConfig {
}
