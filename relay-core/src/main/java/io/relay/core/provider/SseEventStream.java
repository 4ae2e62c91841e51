package io.relay.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventStream;
import io.relay.core.policy.ErrorClassifier;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import okhttp3.Call;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event stream over one HTTP call. The call is executed on the first read, so a cancel issued before
 * the response arrives still aborts the connection attempt.
 */
final class SseEventStream implements EventStream {
    private static final Logger LOG = LoggerFactory.getLogger(SseEventStream.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long MAX_ERROR_BODY_BYTES = 16_384;

    private final Call call;
    private final SseTranslator translator;
    private final ErrorClassifier classifier;
    private final Deque<CanonicalEvent> pending = new ArrayDeque<>();
    private Response response;
    private SseEventReader reader;
    private boolean terminated;
    private volatile boolean cancelled;

    SseEventStream(Call call, SseTranslator translator, ErrorClassifier classifier) {
        this.call = call;
        this.translator = translator;
        this.classifier = classifier;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !terminated) {
            pump();
        }
        return !pending.isEmpty();
    }

    @Override
    public CanonicalEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream is exhausted");
        }
        return pending.poll();
    }

    @Override
    public void cancel() {
        cancelled = true;
        call.cancel();
    }

    @Override
    public void close() {
        terminated = true;
        if (response != null) {
            response.close();
        } else {
            call.cancel();
        }
    }

    private void pump() {
        try {
            if (reader == null) {
                start();
                return;
            }
            SseEvent event = reader.next();
            if (event == null) {
                translator.onEnd(this::offer);
                if (!terminated) {
                    fail(ProviderError.of(ErrorKind.MALFORMED_STREAM, "stream ended without a terminal event"));
                }
                return;
            }
            translator.onEvent(event, this::offer);
        } catch (IOException e) {
            if (cancelled) {
                fail(ProviderError.of(ErrorKind.NETWORK_ERROR, "stream cancelled"));
            } else {
                LOG.debug("Stream read failed for {}", call.request().url(), e);
                fail(classifier.fromException(e));
            }
        } catch (RelayException e) {
            fail(e.error());
        }
    }

    private void start() throws IOException {
        response = call.execute();
        if (!response.isSuccessful()) {
            String body = response.peekBody(MAX_ERROR_BODY_BYTES).string();
            fail(classifier.fromHttpStatus(response.code(), body, response::header));
            return;
        }
        ResponseBody body = response.body();
        if (body == null) {
            fail(ProviderError.of(ErrorKind.MALFORMED_STREAM, "response has no body"));
            return;
        }
        String contentType = response.header("Content-Type", "");
        if (contentType.contains("json") && !contentType.contains("event-stream")) {
            fail(errorFromJsonBody(response.peekBody(MAX_ERROR_BODY_BYTES).string()));
            return;
        }
        reader = new SseEventReader(body.source());
    }

    private ProviderError errorFromJsonBody(String body) {
        try {
            JsonNode error = MAPPER.readTree(body).path("error");
            if (error.isObject()) {
                String code = error.path("code").asText(error.path("type").asText(""));
                return classifier.fromErrorCode(code, error.path("message").asText(""));
            }
        } catch (IOException ignored) {
            // fall through to the generic diagnostic
        }
        return ProviderError.of(ErrorKind.MALFORMED_STREAM, "expected an event stream but received a JSON document");
    }

    private void fail(ProviderError error) {
        offer(new CanonicalEvent.StreamError(error));
    }

    private void offer(CanonicalEvent event) {
        if (terminated) {
            return;
        }
        pending.add(event);
        if (event.isTerminal()) {
            terminated = true;
            if (response != null) {
                response.close();
            }
        }
    }
}
