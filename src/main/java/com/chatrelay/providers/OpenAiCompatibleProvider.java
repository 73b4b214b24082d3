package com.chatrelay.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Backend reached over an OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class OpenAiCompatibleProvider implements ModelProvider {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    private final String id;
    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiCompatibleProvider(String id, String apiKey, String baseUrl, String defaultModel) {
        this(id, apiKey, baseUrl, defaultModel, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    OpenAiCompatibleProvider(String id, String apiKey, String baseUrl, String defaultModel, HttpClient httpClient) {
        this.id = id;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.httpClient = httpClient;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            var resp = httpClient.send(buildRequest(request, false), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw ProviderFailures.fromStatus(id, resp.statusCode(), resp.body());
            }
            var respBody = resp.body().trim();
            if (respBody.startsWith("{")) {
                return parseResponse(mapper.readTree(respBody));
            }
            if (ProviderFailures.isHtml(respBody)) {
                throw ProviderFailures.blocked(id);
            }
            return parseSSE(respBody);
        } catch (HttpTimeoutException e) {
            throw new ProviderException(id, ProviderException.Kind.TIMEOUT, "Provider " + id + " timed out", e);
        } catch (IOException e) {
            throw new ProviderException(id, ProviderException.Kind.UPSTREAM, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, ProviderException.Kind.TIMEOUT, "Interrupted waiting for " + id, e);
        }
    }

    @Override
    public Iterator<ChatEvent> chatStream(ChatRequest request) {
        try {
            var resp = httpClient.send(buildRequest(request, true), HttpResponse.BodyHandlers.ofLines());
            if (resp.statusCode() != 200) {
                String body;
                try (var lines = resp.body()) {
                    body = lines.limit(50).collect(Collectors.joining("\n"));
                }
                throw ProviderFailures.fromStatus(id, resp.statusCode(), body);
            }
            return new SseChunkIterator(resp.body());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(id, ProviderException.Kind.TIMEOUT, "Provider " + id + " timed out", e);
        } catch (IOException e) {
            throw new ProviderException(id, ProviderException.Kind.UPSTREAM, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, ProviderException.Kind.TIMEOUT, "Interrupted waiting for " + id, e);
        }
    }

    private HttpRequest buildRequest(ChatRequest request, boolean stream) throws JsonProcessingException {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model() != null ? request.model() : defaultModel);
        body.put("messages", request.messages());
        if (stream) {
            body.put("stream", true);
        }

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(request.timeout() != null ? request.timeout() : DEFAULT_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private ChatResponse parseResponse(JsonNode root) {
        var content = root.path("choices").path(0).path("message").path("content").asText(null);
        var model = root.path("model").asText(defaultModel);
        return new ChatResponse(model, content != null ? content : "");
    }

    private ChatResponse parseSSE(String sse) throws IOException {
        var contentBuf = new StringBuilder();
        String model = null;
        for (var line : sse.split("\n")) {
            line = line.trim();
            if (!line.startsWith("data:")) continue;
            var data = line.substring(5).trim();
            if ("[DONE]".equals(data)) break;

            var node = mapper.readTree(data);
            if (model == null) model = node.path("model").asText(null);
            var c = node.path("choices").path(0).path("delta").path("content").asText(null);
            if (c != null) contentBuf.append(c);
        }
        return new ChatResponse(model != null ? model : defaultModel, contentBuf.toString());
    }

    /**
     * Lazily turns SSE lines into content deltas. Lines that are not SSE at all
     * (an HTML block page, plain text) are passed through untouched so the
     * relay can classify them.
     */
    private final class SseChunkIterator implements Iterator<ChatEvent>, AutoCloseable {

        private final Stream<String> lines;
        private final Iterator<String> source;
        private ChatEvent next;
        private boolean finished;

        SseChunkIterator(Stream<String> lines) {
            this.lines = lines;
            this.source = lines.iterator();
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (finished) return false;
            while (source.hasNext()) {
                var delta = toDelta(source.next());
                if (delta == null) continue;
                if ("[DONE]".equals(delta)) break;
                next = ChatEvent.chunk(delta);
                return true;
            }
            close();
            return false;
        }

        @Override
        public void close() {
            finished = true;
            lines.close();
        }

        @Override
        public ChatEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            var event = next;
            next = null;
            return event;
        }

        private String toDelta(String raw) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith(":") || line.startsWith("event:") || line.startsWith("id:")) {
                return null;
            }
            if (!line.startsWith("data:")) {
                return raw;
            }
            var data = line.substring(5).trim();
            if ("[DONE]".equals(data)) return data;
            try {
                var c = mapper.readTree(data).path("choices").path(0).path("delta").path("content").asText(null);
                return c == null || c.isEmpty() ? null : c;
            } catch (JsonProcessingException e) {
                return data;
            }
        }
    }
}
