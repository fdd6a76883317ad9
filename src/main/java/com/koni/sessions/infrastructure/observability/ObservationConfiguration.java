package com.koni.sessions.infrastructure.observability;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Configuration for enabling observation aspects.
 * This makes @Observed on the command handler and the upsert coordinator produce
 * timers and observations.
 */
@Configuration
@EnableAspectJAutoProxy
public class ObservationConfiguration {

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
