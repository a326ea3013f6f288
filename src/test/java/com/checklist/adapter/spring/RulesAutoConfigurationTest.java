package com.checklist.adapter.spring;

import com.checklist.batch.RuleBatchCompiler;
import com.checklist.config.RulesConfig;
import com.checklist.core.RuleEngine;
import com.checklist.emit.PercentMode;
import com.checklist.spring.EnableChecklistRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RulesAutoConfiguration.
 */
class RulesAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(RulesAutoConfiguration.class);

    @Test
    @DisplayName("Creates the engine from the bundled configuration")
    void createsBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(RuleEngine.class));
            assertNotNull(context.getBean(RuleBatchCompiler.class));
            assertEquals(RulesConfig.DEFAULT_NAME, context.getBean(RulesConfig.class).name());
        });
    }

    @Test
    @DisplayName("Reads the configuration path from properties")
    void customConfigPath() {
        contextRunner
                .withPropertyValues("checklist-rules.config-path=classpath:rules-fraction.yaml")
                .run(context -> {
                    RuleEngine engine = context.getBean(RuleEngine.class);
                    assertEquals(PercentMode.FRACTION, engine.getConfig().percentMode());
                    assertEquals("if(number(${Q1}) >= 0.8, 'green', 'red')",
                            engine.emitExpression(engine.parseRule("If >=80% = Green"), "Q1"));
                });
    }

    @Test
    @DisplayName("Can be disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("checklist-rules.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(RuleEngine.class).isEmpty()));
    }

    @Test
    @DisplayName("Closes the batch compiler with the context")
    void closesCompiler() {
        RuleBatchCompiler[] compiler = new RuleBatchCompiler[1];
        contextRunner.run(context -> compiler[0] = context.getBean(RuleBatchCompiler.class));

        assertTrue(compiler[0].isClosed());
    }

    @Test
    @DisplayName("The enable annotation imports the auto-configuration")
    void enableAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(RulesApplication.class)
                .run(context -> assertEquals(1, context.getBeansOfType(RuleEngine.class).size()));
    }

    @Configuration
    @EnableChecklistRules
    static class RulesApplication {
    }
}
