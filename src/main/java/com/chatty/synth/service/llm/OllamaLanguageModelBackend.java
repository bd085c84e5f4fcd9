package com.chatty.synth.service.llm;

import com.chatty.synth.config.properties.BackendProperties;
import com.chatty.synth.exception.BackendException;
import com.chatty.synth.util.LogSanitizer;
import com.chatty.synth.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * {@link LanguageModelBackend} that calls an Ollama server's {@code /api/generate} endpoint
 * with streaming disabled.
 *
 * <p>Request body: {@code {"model", "prompt", "stream": false, "options": {"temperature", "top_p"}}}.
 * The completion is read from the {@code response} field of the reply.
 */
@Component
public class OllamaLanguageModelBackend implements LanguageModelBackend {

    private static final Logger LOG = LogManager.getLogger(OllamaLanguageModelBackend.class);
    static final String GENERATE_PATH = "/api/generate";

    private final RestTemplate restTemplate;
    private final BackendProperties props;
    private final String generateUrl;

    public OllamaLanguageModelBackend(@Qualifier("backendRestTemplate") RestTemplate restTemplate,
                                      BackendProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
        this.generateUrl = stripTrailingSlash(props.baseUrl()) + GENERATE_PATH;
    }

    @Override
    public String generate(String model, String prompt) {
        if (model == null || model.isBlank()) {
            throw new BackendException("Model must not be blank", String.valueOf(model));
        }
        long start = System.nanoTime();
        LOG.debug("Calling backend model={} prompt='{}'", model, LogSanitizer.preview(prompt));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> entity = new HttpEntity<>(requestBody(model, prompt).toString(), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(generateUrl, entity, String.class);
        } catch (RestClientResponseException e) {
            throw new BackendException("Backend returned HTTP " + e.getStatusCode().value(), model, e);
        } catch (RestClientException e) {
            throw new BackendException("Backend call failed: " + e.getMessage(), model, e);
        }

        String text = extractResponse(response.getBody(), model);
        LOG.debug("Backend model={} answered in {}ms ({} chars)", model, TimeUtils.elapsedMillis(start), text.length());
        return text;
    }

    JSONObject requestBody(String model, String prompt) {
        JSONObject options = new JSONObject()
                .put("temperature", props.temperature())
                .put("top_p", props.topP());
        return new JSONObject()
                .put("model", model)
                .put("prompt", prompt == null ? "" : prompt)
                .put("stream", false)
                .put("options", options);
    }

    static String extractResponse(String body, String model) {
        if (body == null || body.isBlank()) {
            throw new BackendException("Empty response body", model);
        }
        try {
            JSONObject obj = new JSONObject(body);
            if (!obj.has("response") || obj.isNull("response")) {
                throw new BackendException("Response field missing", model);
            }
            return obj.optString("response", "");
        } catch (JSONException e) {
            throw new BackendException("Malformed response body", model, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
