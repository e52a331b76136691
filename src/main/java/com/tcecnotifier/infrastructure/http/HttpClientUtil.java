package com.tcecnotifier.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Utility for the notifier's HTTP calls: the live PGN feed, the subscriber
 * configuration and the Discord webhooks.
 *
 * Redirects are never followed.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    private static CloseableHttpClient createClient() {
        return HttpClients.custom()
            .disableRedirectHandling()
            .build();
    }

    /**
     * Makes a GET request and returns the response body as text.
     */
    public static String getText(String url, Map<String, String> headers) throws IOException {
        try (CloseableHttpClient httpClient = createClient()) {
            HttpGet request = new HttpGet(url);

            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                String responseBody = readBody(response.getEntity());

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("GET {} failed with status {}", url, statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }

                return responseBody;
            }
        }
    }

    /**
     * Makes a GET request and parses the response with the given mapper.
     */
    public static JsonNode getJson(String url, Map<String, String> headers, ObjectMapper mapper) throws IOException {
        String responseBody = getText(url, headers);
        try {
            return mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON. URL: {}", url);
            logResponseBodyPreview(responseBody);
            throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * POSTs a JSON body; any non-2xx answer is an error.
     */
    public static void postJson(String url, JsonNode body) throws IOException {
        try (CloseableHttpClient httpClient = createClient()) {
            HttpPost request = new HttpPost(url);
            request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                String responseBody = readBody(response.getEntity());

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("POST failed with status {}", statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }
            }
        }
    }

    private static String readBody(HttpEntity entity) throws IOException {
        if (entity == null) {
            return "";
        }
        try {
            return EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (org.apache.hc.core5.http.ParseException e) {
            throw new IOException("Failed to parse response", e);
        }
    }
}
