package com.quillmind.core.config;

import com.quillmind.core.resolution.DefaultNarrativeCoherenceAnalyzer;
import com.quillmind.core.resolution.DefaultUserPreferenceEngine;
import com.quillmind.core.resolution.NarrativeCoherenceAnalyzer;
import com.quillmind.core.resolution.UserPreferenceEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators for the validation and resolution engines.
 * Each bean backs off when the application defines its own.
 */
@Configuration
public class QuillmindConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(UserPreferenceEngine.class)
    public UserPreferenceEngine userPreferenceEngine() {
        return new DefaultUserPreferenceEngine();
    }

    @Bean
    @ConditionalOnMissingBean(NarrativeCoherenceAnalyzer.class)
    public NarrativeCoherenceAnalyzer narrativeCoherenceAnalyzer() {
        return new DefaultNarrativeCoherenceAnalyzer();
    }
}
