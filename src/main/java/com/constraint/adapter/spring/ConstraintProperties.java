package com.constraint.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for constraint validation.
 */
@ConfigurationProperties(prefix = "constraints")
public class ConstraintProperties {

    /**
     * Whether constraint validation is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the constraint set file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:constraints.yaml";

    /**
     * Text rendered in messages for a path that does not resolve.
     */
    private String missingValueText = "UNDEFINED_VALUE";

    /**
     * Log every compilation step at debug level.
     */
    private boolean trace = false;

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

    public String getMissingValueText() {
        return missingValueText;
    }

    public void setMissingValueText(String missingValueText) {
        this.missingValueText = missingValueText;
    }

    public boolean isTrace() {
        return trace;
    }

    public void setTrace(boolean trace) {
        this.trace = trace;
    }
}
