package org.example.stylelock.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Delegates scoring to an HTTP similarity service: {@code POST /score} with the artifact
 * and baseline references, answering {@code {"score": 9.1}}.
 */
@Service
public class RemoteConsistencyScorer implements ConsistencyScorer {

    private static final Logger log = LoggerFactory.getLogger(RemoteConsistencyScorer.class);

    private final WebClient webClient;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public RemoteConsistencyScorer(
            @Value("${scoring.base-url:http://localhost:8090}") String baseUrl,
            @Value("${scoring.timeout-seconds:60}") int timeoutSeconds) {
        this(WebClient.builder().baseUrl(baseUrl).build(), timeoutSeconds);
        log.info("Consistency scorer initialized with endpoint: {}", baseUrl);
    }

    RemoteConsistencyScorer(WebClient webClient, int timeoutSeconds) {
        this.webClient = webClient;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public double score(String artifactRef, String baselineRef) throws ScoringUnavailableException {
        if (baselineRef == null || baselineRef.isBlank()) {
            throw new ScoringUnavailableException("No baseline reference for " + artifactRef);
        }

        String response;
        try {
            response = webClient.post()
                    .uri("/score")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("artifact", artifactRef, "baseline", baselineRef))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("Scoring service error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ScoringUnavailableException("Scoring service error: " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new ScoringUnavailableException("Scoring service unreachable: " + e.getMessage(), e);
        }

        try {
            JsonNode node = objectMapper.readTree(response == null ? "" : response);
            JsonNode score = node == null ? null : node.get("score");
            if (score == null || !score.isNumber()) {
                throw new ScoringUnavailableException("Scoring response has no numeric score");
            }
            double value = score.asDouble();
            if (!Double.isFinite(value)) {
                throw new ScoringUnavailableException("Scoring response score out of range: " + score.asText());
            }
            return value;
        } catch (ScoringUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new ScoringUnavailableException("Unreadable scoring response", e);
        }
    }
}
