package com.deepansh.lineage.store;

import com.deepansh.lineage.exception.LineageAgentException;
import com.deepansh.lineage.llm.LlmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Turns query text into a vector via the local model server's embeddings API.
 *
 * Caching strategy:
 * - Embeddings for the same text are deterministic, so cache aggressively
 * - Redis cache key: lineage:embed:{md5(model + text)}
 * - TTL: 7 days
 *
 * Cache failures never fail the call; Redis being down only costs an extra request.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "lineage:embed:";
    private static final Duration CACHE_TTL = Duration.ofDays(7);

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final LlmProperties llmProperties;

    public EmbeddingService(@Qualifier("llmRestClientBuilder") RestClient.Builder restClientBuilder,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper,
                            LlmProperties llmProperties) {
        this.restClient = restClientBuilder.clone().build();
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.llmProperties = llmProperties;
    }

    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + hashText(text);

        float[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Embedding cache hit for text length={}", text.length());
            return cached;
        }

        float[] embedding = fetchEmbedding(text);

        try {
            redisTemplate.opsForValue().set(
                    cacheKey, objectMapper.writeValueAsString(embedding), CACHE_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }

        return embedding;
    }

    private float[] readCache(String cacheKey) {
        try {
            String json = redisTemplate.opsForValue().get(cacheKey);
            return json != null ? objectMapper.readValue(json, float[].class) : null;
        } catch (Exception e) {
            log.warn("Embedding cache read failed, re-fetching: {}", e.getMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri("/api/embeddings")
                .body(Map.of(
                        "model", llmProperties.getEmbeddingModel(),
                        "prompt", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        Object raw = response != null ? response.get("embedding") : null;
        if (!(raw instanceof List<?> values) || values.isEmpty()) {
            throw new LineageAgentException("Embedding response contained no vector");
        }

        List<Number> numbers = (List<Number>) values;
        float[] result = new float[numbers.size()];
        for (int i = 0; i < numbers.size(); i++) {
            result[i] = numbers.get(i).floatValue();
        }

        log.debug("Fetched embedding: {} dimensions", result.length);
        return result;
    }

    private String hashText(String text) {
        String material = llmProperties.getEmbeddingModel() + "\n" + text;
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }
}
