package com.marquee.backend.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.exception.AiProviderException;
import com.marquee.backend.exception.AuthenticationException;
import com.marquee.backend.exception.InvalidRequestException;
import com.marquee.backend.exception.OverloadedException;
import com.marquee.backend.exception.RateLimitException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * JSON-over-HTTP plumbing shared by the provider clients: POST, parse, and map HTTP failures onto the
 * provider exception hierarchy.
 */
@Slf4j
public abstract class HttpAiProvider implements AiProvider {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;

    protected HttpAiProvider(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    protected JsonNode post(String url, Map<String, String> headerValues, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headerValues.forEach(headers::set);
        try {
            String payload = objectMapper.writeValueAsString(body);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(payload, headers), String.class);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                throw new AiProviderException(getName(), "Empty response from " + getName());
            }
            return objectMapper.readTree(responseBody);
        } catch (RestClientResponseException e) {
            throw classify(e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.warn("AI provider unreachable provider={} message={}", getName(), e.getMessage());
            throw new AiProviderException(getName(), getName() + " unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new AiProviderException(getName(), "Malformed JSON exchanged with " + getName(), e);
        }
    }

    protected AiProviderException classify(int status, String body, Throwable cause) {
        String message = getName() + " API error (" + status + "): " + summarize(body);
        return switch (status) {
            case 429 -> new RateLimitException(getName(), message, status, cause);
            case 401, 403 -> new AuthenticationException(getName(), message, status, cause);
            case 400 -> new InvalidRequestException(getName(), message, status, cause);
            case 503, 529 -> new OverloadedException(getName(), message, status, cause);
            default -> new AiProviderException(getName(), message, status, cause);
        };
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> parseArguments(JsonNode node) {
        try {
            if (node == null || node.isNull()) {
                return Map.of();
            }
            if (node.isTextual()) {
                String raw = node.asText();
                return raw.isBlank() ? Map.of() : objectMapper.readValue(raw, Map.class);
            }
            return objectMapper.convertValue(node, Map.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AiProviderException(getName(), "Unparseable tool arguments from " + getName(), e);
        }
    }

    protected String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AiProviderException(getName(), "Unserializable tool arguments", e);
        }
    }

    private static String summarize(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
