package com.guardian.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardian.backend.service.advisor.AdviceParser;
import com.guardian.backend.service.advisor.HttpPositionAdvisor;
import com.guardian.backend.service.advisor.PositionAdvisor;
import com.guardian.backend.service.advisor.RuleBasedPositionAdvisor;
import com.guardian.backend.service.risk.RiskThresholds;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class AdvisorConfig {

    @Bean
    public RestTemplate advisorRestTemplate(AdvisorProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    public CircuitBreaker advisorCircuitBreaker(AdvisorProperties properties) {
        AdvisorProperties.Circuit circuit = properties.getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("advisor", config);
    }

    @Bean
    public AdviceParser adviceParser(ObjectMapper objectMapper, RiskThresholds thresholds) {
        return new AdviceParser(objectMapper, thresholds.defaultConfidence());
    }

    @Bean
    public PositionAdvisor positionAdvisor(AdvisorProperties properties,
                                           @Qualifier("advisorRestTemplate") RestTemplate restTemplate,
                                           CircuitBreaker advisorCircuitBreaker,
                                           AdviceParser adviceParser) {
        if ("http".equalsIgnoreCase(properties.getProvider())) {
            log.info("Using remote position advisor at {}", properties.getHttp().getBaseUrl());
            return new HttpPositionAdvisor(restTemplate, advisorCircuitBreaker, adviceParser,
                    properties.getHttp().getBaseUrl());
        }
        log.info("Using rule-based position advisor");
        return new RuleBasedPositionAdvisor();
    }
}
