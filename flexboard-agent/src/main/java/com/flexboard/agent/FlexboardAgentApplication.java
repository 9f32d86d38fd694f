package com.flexboard.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * On-prem agent: executes dashboard widget queries against the customer's own data sources.
 */
// the engine builds its own MongoClient per tenant pool
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class FlexboardAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlexboardAgentApplication.class, args);
    }
}
