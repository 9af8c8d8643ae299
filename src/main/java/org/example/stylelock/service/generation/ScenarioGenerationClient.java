package org.example.stylelock.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.example.stylelock.model.GeneratedArtifact;
import org.example.stylelock.model.GenerationProgress;
import org.example.stylelock.model.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * {@link GenerationClient} for the Scenario text-to-image REST API.
 */
@Service
public class ScenarioGenerationClient implements GenerationClient {

  private static final Logger log = LoggerFactory.getLogger(ScenarioGenerationClient.class);
  private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

  private final WebClient webClient;
  private final String cacheDir;
  private final Duration requestTimeout;
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Autowired
  public ScenarioGenerationClient(
      @Value("${generation.base-url:https://api.cloud.scenario.com/v1}") String baseUrl,
      @Value("${generation.api-key:}") String apiKey,
      @Value("${generation.api-secret:}") String apiSecret,
      @Value("${generation.cache-dir:./data/generated}") String cacheDir,
      @Value("${generation.request-timeout-seconds:30}") int requestTimeoutSeconds) {
    this(buildWebClient(baseUrl, apiKey, apiSecret), cacheDir, requestTimeoutSeconds);
    log.info("Scenario generation client initialized with endpoint: {}", baseUrl);
  }

  ScenarioGenerationClient(WebClient webClient, String cacheDir, int requestTimeoutSeconds) {
    this.webClient = webClient;
    this.cacheDir = cacheDir;
    this.requestTimeout = Duration.ofSeconds(Math.max(1, requestTimeoutSeconds));
  }

  @PostConstruct
  public void init() throws IOException {
    Path cachePath = Paths.get(cacheDir);
    if (!Files.exists(cachePath)) {
      Files.createDirectories(cachePath);
      log.info("Created generated asset cache directory: {}", cacheDir);
    }
  }

  @Override
  public boolean isAvailable() {
    try {
      webClient.get()
          .uri("/models?pageSize=1")
          .retrieve()
          .bodyToMono(String.class)
          .block(Duration.ofSeconds(3));
      return true;
    } catch (Exception e) {
      log.debug("Scenario API not available: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String submit(GenerationRequest request) throws GenerationServiceException {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("prompt", request.prompt());
    payload.put("modelId", request.modelId());
    payload.put("numSamples", 1);
    payload.put("width", request.width());
    payload.put("height", request.height());
    payload.put("guidance", request.cfgScale());
    payload.put("numInferenceSteps", request.steps());
    payload.put("seed", request.seed());

    JsonNode response = exchangeJson("submit", () -> webClient.post()
        .uri("/generate/txt2img")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(payload.toString())
        .retrieve()
        .bodyToMono(String.class)
        .block(requestTimeout));

    String inferenceId = response.path("inference").path("id").asText("");
    if (inferenceId.isBlank()) {
      throw new ServiceUnavailableException("No inference id returned for job " + request.jobId(), false, null);
    }
    log.info("Submitted job {} to Scenario, inference id: {}", request.jobId(), inferenceId);
    return inferenceId;
  }

  @Override
  public GenerationProgress poll(String handle) throws GenerationServiceException {
    JsonNode response = exchangeJson("poll", () -> webClient.get()
        .uri("/generations/{id}", handle)
        .retrieve()
        .bodyToMono(String.class)
        .block(requestTimeout));

    // some responses wrap the payload in an "inference" object
    JsonNode body = response.has("inference") ? response.get("inference") : response;

    List<String> urls = new ArrayList<>();
    JsonNode assets = body.has("images") ? body.get("images") : body.path("assets");
    if (assets.isArray()) {
      for (JsonNode asset : assets) {
        String url = asset.path("url").asText("");
        if (!url.isBlank()) {
          urls.add(url);
        }
      }
    }

    String errorMessage = body.hasNonNull("errorMessage") ? body.get("errorMessage").asText() : null;
    return new GenerationProgress(
        handle,
        mapState(body.path("status").asText("pending")),
        body.path("progress").asDouble(0.0),
        urls,
        errorMessage);
  }

  @Override
  public GeneratedArtifact fetch(String handle) throws GenerationServiceException {
    GenerationProgress progress = poll(handle);
    if (progress.state() != GenerationProgress.State.COMPLETED || progress.assetUrls().isEmpty()) {
      throw new ArtifactNotReadyException("Generation " + handle + " has no downloadable asset (state "
          + progress.state() + ")");
    }

    String url = progress.assetUrls().get(0);
    byte[] imageData;
    try {
      imageData = webClient.get()
          .uri(URI.create(url))
          .retrieve()
          .bodyToMono(byte[].class)
          .block(Duration.ofSeconds(60));
    } catch (RuntimeException e) {
      throw new DownloadFailedException("Failed to download asset for " + handle, e);
    }
    if (imageData == null || imageData.length == 0) {
      throw new DownloadFailedException("Empty asset downloaded for " + handle, null);
    }

    try {
      Path target = safeResolve(cacheDir, handle + ".png");
      Files.createDirectories(target.getParent());
      Files.write(target, imageData);
      log.info("Downloaded and cached asset: {}", target);
      return new GeneratedArtifact(handle, target.toString(), "image/png", imageData.length);
    } catch (IOException e) {
      throw new DownloadFailedException("Failed to store asset for " + handle, e);
    }
  }

  static GenerationProgress.State mapState(String status) {
    String normalized = status == null ? "" : status.toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "completed", "succeeded", "success" -> GenerationProgress.State.COMPLETED;
      case "processing", "running", "in-progress" -> GenerationProgress.State.PROCESSING;
      case "failed", "error", "canceled", "cancelled" -> GenerationProgress.State.FAILED;
      default -> GenerationProgress.State.PENDING;
    };
  }

  static GenerationServiceException classify(String operation, WebClientResponseException e) {
    int status = e.getStatusCode().value();
    if (status == 429) {
      Duration retryAfter = parseRetryAfter(e.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
      return new ServiceUnavailableException("Scenario API rate limited " + operation, true, retryAfter);
    }
    if (status == 408 || e.getStatusCode().is5xxServerError()) {
      return new ServiceUnavailableException("Scenario API " + operation + " failed: " + status, false, null);
    }
    return new InvalidRequestException("Scenario API rejected " + operation + ": " + status
        + " " + e.getResponseBodyAsString(), status);
  }

  static Duration parseRetryAfter(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return DEFAULT_RETRY_AFTER;
    }
    try {
      return Duration.ofSeconds(Math.max(0, Long.parseLong(headerValue.trim())));
    } catch (NumberFormatException e) {
      return DEFAULT_RETRY_AFTER;
    }
  }

  private JsonNode exchangeJson(String operation, ResponseCall call) throws GenerationServiceException {
    String response;
    try {
      response = call.execute();
    } catch (WebClientResponseException e) {
      log.warn("Scenario API {} error: {} - {}", operation, e.getStatusCode(), e.getResponseBodyAsString());
      throw classify(operation, e);
    } catch (RuntimeException e) {
      throw new ServiceUnavailableException("Scenario API " + operation + " failed: " + e.getMessage(), e);
    }
    if (response == null || response.isBlank()) {
      throw new ServiceUnavailableException("Empty response from Scenario API " + operation, false, null);
    }
    try {
      return objectMapper.readTree(response);
    } catch (JsonProcessingException e) {
      throw new ServiceUnavailableException("Unreadable response from Scenario API " + operation, e);
    }
  }

  private static WebClient buildWebClient(String baseUrl, String apiKey, String apiSecret) {
    WebClient.Builder builder = WebClient.builder()
        .baseUrl(baseUrl)
        .codecs(configurer -> configurer
            .defaultCodecs()
            .maxInMemorySize(16 * 1024 * 1024));
    if (apiKey != null && !apiKey.isBlank()) {
      String credentials = apiKey + ":" + (apiSecret == null ? "" : apiSecret);
      String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
    } else {
      log.warn("Scenario API key not configured; requests will be sent unauthenticated");
    }
    return builder.build();
  }

  private Path safeResolve(String baseDir, String filename) {
    Path basePath = Paths.get(baseDir).toAbsolutePath().normalize();
    Path resolved = basePath.resolve(filename).normalize();
    if (!resolved.startsWith(basePath)) {
      return basePath.resolve(Paths.get(filename).getFileName().toString());
    }
    return resolved;
  }

  @FunctionalInterface
  private interface ResponseCall {
    String execute();
  }
}
