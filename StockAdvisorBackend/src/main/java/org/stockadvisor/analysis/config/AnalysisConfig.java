package org.stockadvisor.analysis.config;

import org.stockadvisor.analysis.patterns.ChartPatternRegistry;
import org.stockadvisor.analysis.safety.SafetyRuleEvaluator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Analysis Engine Configuration
 * Builds the detector registry and the safety evaluator from the bound properties
 */
@Configuration("analysisConfig")
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfig {

    @Bean
    public ChartPatternRegistry chartPatternRegistry(AnalysisProperties properties) {
        return ChartPatternRegistry.withDefaultDetectors(properties.getPatterns());
    }

    @Bean
    public SafetyRuleEvaluator safetyRuleEvaluator(AnalysisProperties properties) {
        return new SafetyRuleEvaluator(properties.getSafety());
    }
}
