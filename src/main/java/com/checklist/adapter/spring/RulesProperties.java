package com.checklist.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for checklist rules.
 */
@ConfigurationProperties(prefix = "checklist-rules")
public class RulesProperties {

    /**
     * Whether the rule engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rules dialect configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:checklist-rules.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
