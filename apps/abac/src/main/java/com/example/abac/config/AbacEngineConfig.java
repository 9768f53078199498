package com.example.abac.config;

import com.example.abac.function.AbacFunction;
import com.example.abac.function.FunctionRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumSet;

@Configuration
public class AbacEngineConfig {

    /**
     * Source of {@code environment.current_time}. Server local time, since working-hour
     * checks are meant in local terms.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock abacClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FunctionRegistry functionRegistry() {
        return new FunctionRegistry(EnumSet.allOf(AbacFunction.class));
    }
}
