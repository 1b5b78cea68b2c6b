package com.enterprise.querybuilder.spring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the query builder.
 *
 * <p>Provides a {@link QueryBuilderFactory} bound to {@code querybuilder.dialect}
 * and, unless {@code querybuilder.sample.enabled=false}, a {@link SampleQueryRunner}.
 * Import this configuration or let component scanning pick it up:
 * <pre>{@code
 * @Import(QueryBuilderConfig.class)
 * @Configuration
 * public class MyConfig { ... }
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(QueryBuilderProperties.class)
public class QueryBuilderConfig {

    @Bean
    public QueryBuilderFactory queryBuilderFactory(QueryBuilderProperties properties) {
        return new QueryBuilderFactory(properties.getDialect());
    }

    @Bean
    @ConditionalOnProperty(prefix = "querybuilder.sample", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SampleQueryRunner sampleQueryRunner(QueryBuilderFactory factory) {
        return new SampleQueryRunner(factory);
    }
}
