package io.relay.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.RelayException;
import io.relay.core.event.CanonicalEvent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolCallTrackerTest {

    private final ToolCallTracker tracker = new ToolCallTracker();

    @Test
    void shouldAssembleInterleavedCallsInCloseOrder() {
        tracker.apply(new CanonicalEvent.ToolCallOpen("a", "read_file"));
        tracker.apply(new CanonicalEvent.ToolCallOpen("b", "list"));
        tracker.apply(new CanonicalEvent.ToolCallArgDelta("b", "{\"dir\":"));
        tracker.apply(new CanonicalEvent.ToolCallArgDelta("a", "{\"path\":\"x\"}"));
        tracker.apply(new CanonicalEvent.ToolCallArgDelta("b", "\".\"}"));
        tracker.apply(new CanonicalEvent.ToolCallClose("b"));

        assertThat(tracker.hasOpen()).isTrue();
        assertThat(tracker.openIds()).containsExactly("a");

        tracker.apply(new CanonicalEvent.ToolCallClose("a"));

        List<ToolCallTracker.CompletedCall> calls = tracker.completed();
        assertThat(calls).extracting(ToolCallTracker.CompletedCall::id).containsExactly("b", "a");
        assertThat(calls.get(0).arguments()).isEqualTo(Map.of("dir", "."));
        assertThat(calls.get(1).arguments()).isEqualTo(Map.of("path", "x"));
        assertThat(tracker.hasOpen()).isFalse();
    }

    @Test
    void shouldTreatEmptyArgumentsAsEmptyObject() {
        tracker.apply(new CanonicalEvent.ToolCallOpen("a", "now"));
        tracker.apply(new CanonicalEvent.ToolCallClose("a"));

        ToolCallTracker.CompletedCall call = tracker.completed().get(0);
        assertThat(call.hasValidArguments()).isTrue();
        assertThat(call.arguments()).isEmpty();
    }

    @Test
    void shouldFlagArgumentsThatAreNotAnObject() {
        tracker.apply(new CanonicalEvent.ToolCallOpen("a", "read_file"));
        tracker.apply(new CanonicalEvent.ToolCallArgDelta("a", "[1, 2]"));
        tracker.apply(new CanonicalEvent.ToolCallClose("a"));
        tracker.apply(new CanonicalEvent.ToolCallOpen("b", "read_file"));
        tracker.apply(new CanonicalEvent.ToolCallArgDelta("b", "{\"path\""));
        tracker.apply(new CanonicalEvent.ToolCallClose("b"));

        List<ToolCallTracker.CompletedCall> calls = tracker.completed();
        assertThat(calls.get(0).argumentError()).isEqualTo("arguments must be a JSON object");
        assertThat(calls.get(1).argumentError()).startsWith("arguments are not valid JSON");
        assertThat(calls.get(1).rawArguments()).isEqualTo("{\"path\"");
    }

    @Test
    void shouldRejectEventsOutOfOrder() {
        assertMalformed(new CanonicalEvent.ToolCallArgDelta("a", "{}"));
        assertMalformed(new CanonicalEvent.ToolCallClose("a"));

        tracker.apply(new CanonicalEvent.ToolCallOpen("a", "read_file"));
        assertMalformed(new CanonicalEvent.ToolCallOpen("a", "read_file"));

        tracker.apply(new CanonicalEvent.ToolCallClose("a"));
        assertMalformed(new CanonicalEvent.ToolCallArgDelta("a", "{}"));
        assertMalformed(new CanonicalEvent.ToolCallClose("a"));
        assertMalformed(new CanonicalEvent.ToolCallOpen("a", "read_file"));
    }

    @Test
    void shouldIgnoreEventsThatAreNotToolScoped() {
        tracker.apply(new CanonicalEvent.TextDelta("hello"));

        assertThat(tracker.completed()).isEmpty();
        assertThat(tracker.hasOpen()).isFalse();
    }

    private void assertMalformed(CanonicalEvent event) {
        assertThatThrownBy(() -> tracker.apply(event))
            .isInstanceOfSatisfying(RelayException.class,
                error -> assertThat(error.kind()).isEqualTo(ErrorKind.MALFORMED_STREAM));
    }
}
