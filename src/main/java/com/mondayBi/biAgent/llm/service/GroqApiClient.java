package com.mondayBi.biAgent.llm.service;

import com.mondayBi.biAgent.llm.dto.GroqApiRequest;
import com.mondayBi.biAgent.llm.dto.GroqApiResponse;
import com.mondayBi.biAgent.llm.exception.GroqApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Blocking client for Groq's OpenAI-compatible chat completions endpoint.
 * Used for both the planning and the synthesis call.
 * <p>
 * Calls are blocking and are not retried here.
 * </p>
 */
@Slf4j
@Service
public class GroqApiClient {

    private static final String DEFAULT_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private RestClient restClient;

    @Value("${groq.api.url:" + DEFAULT_API_URL + "}")
    private String apiUrl;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String model;

    @Value("${groq.api.temperature:0.1}")
    private Double temperature;

    private RestClient getRestClient() {
        if (restClient == null) {
            this.restClient = RestClient.builder()
                    .baseUrl(apiUrl)
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        }
        return restClient;
    }

    /**
     * Sends a system prompt followed by a message history and returns the reply text.
     *
     * @param systemPrompt        System prompt for the task
     * @param messages            Conversation messages, oldest first; the last one is the current request
     * @param maxCompletionTokens Upper bound on the reply length
     * @return Reply text, trimmed
     * @throws GroqApiException if the call fails or the reply is empty
     */
    public String chat(String systemPrompt, List<GroqApiRequest.Message> messages, int maxCompletionTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("groq.api.key is empty; set GROQ_API_KEY");
        }

        List<GroqApiRequest.Message> allMessages = new ArrayList<>(messages.size() + 1);
        allMessages.add(GroqApiRequest.Message.system(systemPrompt));
        allMessages.addAll(messages);

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(allMessages)
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false)
                .build();

        GroqApiResponse response;
        try {
            log.debug("Calling Groq API - model: {}, messages: {}", model, allMessages.size());

            response = getRestClient().post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);
        } catch (Exception e) {
            log.error("Groq chat completion failed - model: {}", model, e);
            throw new GroqApiException("Failed to call Groq API: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new GroqApiException("Groq API returned null response");
        }

        String content = response.getContent();
        if (content == null || content.isBlank()) {
            throw new GroqApiException("Groq API returned empty response");
        }

        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

        return content.trim();
    }
}
