package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.AiFeedbackRequest;
import com.NutriCare.diet_backend.exception.FeedbackUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Client for the language-model feedback service (Gemini {@code generateContent}).
 * The nutrient summary and clinical context are forwarded as given; the prose that comes
 * back is returned verbatim and never interpreted here.
 */
@Slf4j
@Service
public class NutritionFeedbackClient {

    private static final String PROMPT_TEMPLATE = String.join("\n",
            "**Task:** You are a clinical nutritionist. Your task is to provide a two-part dietary analysis based on the data provided below.",
            "",
            "**Part 1: Nutritional Analysis**",
            "",
            "Analyze the \"Nutritional Summary\" and compare the \"totalNutrients\" to the \"rdaTargets\".",
            "",
            "- In a section titled \"**Nutritional Analysis**\", create a **numbered list** of your findings.",
            "- For each nutrient, state whether it is within, above, or below the recommended target.",
            "- Briefly explain the clinical significance of any major deviations.",
            "",
            "**Part 2: Personalized Recommendations**",
            "",
            "Based on your analysis in Part 1, and considering the patient's \"Co-morbidities\" and \"Diet Preferences\", provide actionable recommendations.",
            "",
            "- In a section titled \"**Personalized Recommendations**\", create a **numbered list** of specific, prioritized dietary suggestions.",
            "- Suggest concrete food choices and meal adjustments.",
            "",
            "**Input Data:**",
            "",
            "*   **Nutritional Summary:** %s",
            "*   **Patient Co-morbidities:** %s",
            "*   **Diet Preferences:** %s",
            "");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String modelName;

    public NutritionFeedbackClient(RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   @Value("${app.feedback.api-url:https://generativelanguage.googleapis.com/v1beta/models}") String apiUrl,
                                   @Value("${app.feedback.api-key:}") String apiKey,
                                   @Value("${app.feedback.model:gemini-2.5-flash}") String modelName) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.modelName = modelName;
        if (this.apiKey.isEmpty()) {
            log.warn("No feedback API key configured (app.feedback.api-key); feedback requests will fail");
        }
    }

    public String requestFeedback(AiFeedbackRequest request) {
        if (apiKey.isEmpty()) {
            throw new FeedbackUnavailableException("AI feedback is not configured");
        }

        String prompt = buildPrompt(request);
        Map<String, Object> payload = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        String url = apiUrl + "/" + modelName + ":generateContent";
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url, new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.error("Feedback service returned {} with body {}", response.getStatusCode(), response.getBody());
                throw new FeedbackUnavailableException("AI feedback service returned an invalid response");
            }
            return extractText(response.getBody());
        } catch (HttpClientErrorException e) {
            log.error("Feedback service rejected the request: status={}, body={}",
                    e.getStatusCode(), e.getResponseBodyAsString());
            if (e.getStatusCode().value() == 429) {
                throw new FeedbackUnavailableException("AI feedback quota exhausted, try again later", e);
            }
            throw new FeedbackUnavailableException("AI feedback request was rejected", e);
        } catch (HttpServerErrorException e) {
            log.error("Feedback service error: status={}", e.getStatusCode());
            throw new FeedbackUnavailableException("AI feedback service is temporarily unavailable", e);
        } catch (ResourceAccessException e) {
            log.error("Feedback service unreachable at {}", apiUrl, e);
            throw new FeedbackUnavailableException("AI feedback service is unreachable", e);
        }
    }

    String buildPrompt(AiFeedbackRequest request) {
        String summary;
        try {
            summary = objectMapper.writeValueAsString(request.getNutritionalSummary());
        } catch (JsonProcessingException e) {
            throw new FeedbackUnavailableException("Could not serialize the nutritional summary", e);
        }
        return String.format(PROMPT_TEMPLATE, summary,
                valueOrNone(request.getCoMorbidities()),
                valueOrNone(request.getDietPreference()));
    }

    private String extractText(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FeedbackUnavailableException("AI feedback response is not valid JSON", e);
        }
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            log.error("Feedback response carried no candidates: {}", body);
            throw new FeedbackUnavailableException("AI feedback response contained no text");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.path("text").isTextual()) {
                text.append(part.path("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new FeedbackUnavailableException("AI feedback response contained no text");
        }
        return text.toString();
    }

    private static String valueOrNone(String value) {
        return value == null || value.trim().isEmpty() ? "None reported" : value.trim();
    }
}
