package com.flexboard.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flexboard.agent.connector.BackendRegistrations;
import com.flexboard.agent.connector.ConnectorRegistry;
import com.flexboard.agent.pool.PoolRegistry;
import com.flexboard.agent.service.QueryDispatcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    /**
     * The dispatcher owns the pools; closing it on shutdown closes every backend handle.
     *
     * @param properties bound engine properties
     * @param objectMapper application object mapper
     * @return dispatcher
     */
    @Bean(destroyMethod = "close")
    public QueryDispatcher queryDispatcher(EngineProperties properties, ObjectMapper objectMapper) {
        properties.validate();
        ConnectorRegistry connectors = BackendRegistrations.fromProperties(properties, objectMapper);
        PoolRegistry pools = new PoolRegistry(properties.getIdleEvictionPeriod());
        return new QueryDispatcher(connectors, pools, properties);
    }
}
