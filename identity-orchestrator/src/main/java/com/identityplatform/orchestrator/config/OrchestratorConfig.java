package com.identityplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.identityplatform.common.fusion.FusionPolicy;
import com.identityplatform.common.model.FusionConfig;
import com.identityplatform.common.model.FusionMethod;
import com.identityplatform.orchestrator.dispatch.DispatchTimeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${identity.fusion.threshold:0.75}")
    private double threshold;

    @Value("${identity.fusion.margin:0.10}")
    private double margin;

    @Value("${identity.fusion.method:DELTA}")
    private String method;

    @Value("${services.verifier.timeout:30s}")
    private Duration verifierTimeout;

    @Value("${services.chatbot.timeout:30s}")
    private Duration chatbotTimeout;

    @Value("${identity.dispatch.overall-deadline:35s}")
    private Duration overallDeadline;

    /** Invalid defaults fail context start. */
    @Bean
    public FusionConfig defaultFusionConfig() {
        FusionConfig config = new FusionConfig(threshold, margin, FusionMethod.fromString(method));
        if (config.isSaturated() && config.method() == FusionMethod.DELTA) {
            log.warn("Fusion config is saturated, DELTA will never yield MATCH. threshold={} margin={}",
                     threshold, margin);
        }
        log.info("Default fusion config. threshold={} margin={} method={}",
                 config.threshold(), config.margin(), config.method());
        return config;
    }

    @Bean
    public DispatchTimeouts dispatchTimeouts() {
        return DispatchTimeouts.of(verifierTimeout, chatbotTimeout, overallDeadline);
    }

    @Bean
    public FusionPolicy fusionPolicy() {
        return FusionPolicy.standard();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
