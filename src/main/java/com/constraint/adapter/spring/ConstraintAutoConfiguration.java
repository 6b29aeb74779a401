package com.constraint.adapter.spring;

import com.constraint.config.ConfigLoader;
import com.constraint.config.ConstraintSetConfig;
import com.constraint.core.ConstraintCompiler;
import com.constraint.function.FunctionRegistry;
import com.constraint.message.MessageRenderer;
import com.constraint.trace.CompilationListener;
import com.constraint.trace.LoggingCompilationListener;
import com.constraint.validation.ConstraintValidator;
import com.constraint.variable.DefaultValueResolver;
import com.constraint.variable.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for constraint validation.
 */
@Configuration
@ConditionalOnProperty(prefix = "constraints", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ConstraintProperties.class)
public class ConstraintAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConstraintAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FunctionRegistry functionRegistry(ObjectProvider<FunctionContributor> contributors) {
        FunctionRegistry registry = new FunctionRegistry();
        contributors.orderedStream().forEach(contributor -> contributor.contribute(registry));
        log.info("Created FunctionRegistry with {} functions: {}", registry.size(), registry.names());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ValueResolver valueResolver() {
        return new DefaultValueResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConstraintCompiler constraintCompiler(FunctionRegistry functionRegistry,
                                                 ValueResolver valueResolver,
                                                 ConstraintProperties properties) {
        CompilationListener listener = properties.isTrace()
                ? new LoggingCompilationListener()
                : CompilationListener.NOOP;
        return new ConstraintCompiler(functionRegistry, valueResolver, listener);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConstraintSetConfig constraintSetConfig(ConstraintProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageRenderer messageRenderer(FunctionRegistry functionRegistry,
                                           ValueResolver valueResolver,
                                           ConstraintProperties properties) {
        return new MessageRenderer(functionRegistry, valueResolver, properties.getMissingValueText());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConstraintValidator constraintValidator(ConstraintSetConfig config,
                                                   ConstraintCompiler compiler,
                                                   MessageRenderer renderer) {
        log.info("Creating ConstraintValidator: {}", config.name());
        return new ConstraintValidator(config, compiler, renderer);
    }
}
