package com.guardian.backend.service.advisor;

import com.guardian.backend.exception.AdvisorException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks a remote advisor service. Requests go through a circuit breaker; there is no retry.
 */
@Slf4j
public class HttpPositionAdvisor implements PositionAdvisor {

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final AdviceParser adviceParser;
    private final String baseUrl;

    public HttpPositionAdvisor(RestTemplate restTemplate, CircuitBreaker circuitBreaker,
                               AdviceParser adviceParser, String baseUrl) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.adviceParser = adviceParser;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Advice advise(PositionContext context, DebateStance stance) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stance", stance.name().toLowerCase(Locale.ROOT));
        body.put("position", context);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        String response;
        try {
            response = circuitBreaker.executeSupplier(() ->
                    restTemplate.postForObject(baseUrl + "/advise", new HttpEntity<>(body, headers), String.class));
        } catch (CallNotPermittedException e) {
            throw new AdvisorException("Advisor circuit open", e);
        } catch (RestClientException e) {
            log.warn("Advisor call failed for {} ({}): {}", context.symbol(), stance, e.getMessage());
            throw new AdvisorException("Advisor call failed: " + e.getMessage(), e);
        }
        return adviceParser.parse(response);
    }
}
