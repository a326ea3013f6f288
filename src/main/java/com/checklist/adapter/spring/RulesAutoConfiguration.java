package com.checklist.adapter.spring;

import com.checklist.batch.RuleBatchCompiler;
import com.checklist.config.ConfigLoader;
import com.checklist.config.RulesConfig;
import com.checklist.core.RuleEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for checklist rules.
 */
@Configuration
@ConditionalOnProperty(prefix = "checklist-rules", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RulesProperties.class)
public class RulesAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RulesAutoConfiguration.class);

    private RuleBatchCompiler batchCompiler;

    @Bean
    @ConditionalOnMissingBean
    public RulesConfig rulesConfig(RulesProperties properties) {
        log.info("Loading rules configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine(RulesConfig config) {
        log.info("Creating RuleEngine: {}", config.name());
        return new RuleEngine(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleBatchCompiler ruleBatchCompiler(RuleEngine engine) {
        this.batchCompiler = new RuleBatchCompiler(engine);
        return this.batchCompiler;
    }

    @PreDestroy
    public void shutdown() {
        if (batchCompiler != null && !batchCompiler.isClosed()) {
            log.info("Shutting down RuleBatchCompiler");
            batchCompiler.close();
        }
    }
}
