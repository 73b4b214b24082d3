package com.chatrelay.gateway.http;

import com.chatrelay.relay.DispatchRequest;
import com.chatrelay.relay.DispatchResult;
import com.chatrelay.relay.Dispatcher;
import com.chatrelay.relay.RelayEvent;
import com.chatrelay.relay.StreamRelay;
import com.chatrelay.relay.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final Dispatcher dispatcher;
    private final StreamRelay streamRelay;
    private final TimeoutPolicy timeouts;
    private final Executor relayExecutor;

    public ChatController(Dispatcher dispatcher, StreamRelay streamRelay, TimeoutPolicy timeouts,
                          @Qualifier("relayExecutor") Executor relayExecutor) {
        this.dispatcher = dispatcher;
        this.streamRelay = streamRelay;
        this.timeouts = timeouts;
        this.relayExecutor = relayExecutor;
    }

    @PostMapping("/chat")
    public Map<String, Object> chat(@RequestBody(required = false) ChatBody body) {
        var request = DispatchRequest.of(
                body != null ? body.message() : null,
                body != null ? body.provider() : null,
                timeouts.defaultTimeout());
        return envelope(dispatcher.dispatch(request));
    }

    @PostMapping("/chat/direct")
    public Map<String, Object> direct(@RequestBody(required = false) DirectBody body) {
        if (body == null || body.message() == null || body.message().isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        var result = dispatcher.direct(body.provider(), body.message(), body.model(),
                timeouts.fromSeconds(body.timeout()));
        return envelope(result);
    }

    @PostMapping("/chat/stream")
    public ResponseEntity<SseEmitter> stream(@RequestBody(required = false) StreamBody body) {
        var request = DispatchRequest.of(
                body != null ? body.message() : null,
                body != null ? body.provider() : null,
                timeouts.fromStreamMillis(body != null ? body.timeoutMs() : null));

        var emitter = new SseEmitter(0L);
        var session = streamRelay.relay(request);
        relayExecutor.execute(() -> pump(session, emitter));

        return ResponseEntity.ok()
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    private void pump(Iterator<RelayEvent> session, SseEmitter emitter) {
        try {
            while (session.hasNext()) {
                var event = session.next();
                emitter.send(SseEmitter.event()
                        .name(event.type())
                        .data(event.payload(), MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException e) {
            log.warn("Client disconnected mid-stream: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Stream relay failed", e);
            emitter.completeWithError(e);
        }
    }

    static Map<String, Object> envelope(DispatchResult result) {
        var body = new LinkedHashMap<String, Object>();
        body.put("success", result.success());
        body.put("response", result.text());
        body.put("provider", result.providerUsed());
        body.put("model", result.model());
        body.put("elapsed", result.elapsedSeconds());
        return body;
    }
}
