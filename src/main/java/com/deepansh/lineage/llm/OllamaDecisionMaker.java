package com.deepansh.lineage.llm;

import com.deepansh.lineage.exception.LineageAgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.HashMap;
import java.util.Map;

/**
 * Decision maker backed by a local Ollama server ({@code POST /api/generate}).
 *
 * Error handling:
 *
 * | Error               | Action                                             |
 * |---------------------|----------------------------------------------------|
 * | non-2xx status      | LineageAgentException with the response body       |
 * | missing "response"  | LineageAgentException                              |
 * | network / timeout   | ResourceAccessException propagates to the caller   |
 *
 * Nothing here retries; {@link ResilientDecisionMaker} turns failures into empty text.
 */
@Component("ollamaDecisionMaker")
@Slf4j
public class OllamaDecisionMaker implements DecisionMaker {

    private final LlmProperties props;
    private final RestClient restClient;

    public OllamaDecisionMaker(LlmProperties props,
                               @Qualifier("llmRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.clone().build();
    }

    @Override
    public String generate(String prompt, int maxTokens) {
        Map<String, Object> requestBody = buildRequestBody(prompt, maxTokens);

        log.debug("Sending prompt of {} chars to ollama [model={}, maxTokens={}]",
                prompt.length(), props.getModel(), maxTokens);

        long start = System.currentTimeMillis();

        Map<String, Object> response = restClient.post()
                .uri("/api/generate")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes());
                    log.error("ollama error [{}]: {}", res.getStatusCode(), body);
                    throw new LineageAgentException(
                            "Ollama error [" + res.getStatusCode().value() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        if (response == null || !(response.get("response") instanceof String text)) {
            throw new LineageAgentException("Ollama returned no 'response' field");
        }

        log.debug("ollama generated {} chars in {}ms", text.length(), System.currentTimeMillis() - start);
        return text;
    }

    private Map<String, Object> buildRequestBody(String prompt, int maxTokens) {
        Map<String, Object> options = new HashMap<>();
        options.put("temperature", props.getTemperature());
        options.put("top_p", props.getTopP());
        options.put("num_predict", maxTokens);

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", options);
        return body;
    }
}
