package com.sandstormtracker.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@Configuration
@EnableMongoRepositories(basePackages = "com.sandstormtracker.repository.mongo")
public class DatabaseConfig {}
