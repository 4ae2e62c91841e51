package io.relay.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StreamTextTest {

    @Test
    void shouldPassThroughOrdinaryDeltas() {
        StreamText text = new StreamText();

        assertThat(text.merge("Hel")).isEqualTo("Hel");
        assertThat(text.merge("lo")).isEqualTo("lo");
        assertThat(text.value()).isEqualTo("Hello");
    }

    @Test
    void shouldEmitOnlySuffixOfCumulativeSnapshots() {
        StreamText text = new StreamText();

        text.merge("The answer");
        assertThat(text.merge("The answer is 42")).isEqualTo(" is 42");
        assertThat(text.value()).isEqualTo("The answer is 42");
    }

    @Test
    void shouldDropLongReplayedTail() {
        StreamText text = new StreamText();
        text.merge("A fairly long sentence here.");

        assertThat(text.merge("long sentence here.")).isEmpty();
        assertThat(text.merge("ok")).isEqualTo("ok");
    }
}
