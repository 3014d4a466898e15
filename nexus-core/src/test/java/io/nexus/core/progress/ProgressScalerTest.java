package io.nexus.core.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressScalerTest {

    @Test
    void shouldScaleIntoSlice() {
        ProgressScaler scaler = new ProgressScaler(0.3, 0.55);

        assertThat(scaler.scale(0.0)).isEqualTo(0.3);
        assertThat(scaler.scale(0.5)).isCloseTo(0.425, within(1e-9));
        assertThat(scaler.scale(1.0)).isCloseTo(0.55, within(1e-9));
    }

    @Test
    void shouldComputeCallSlices() {
        ProgressScaler second = ProgressScaler.slice(1, 2, 0.3, 0.5);

        assertThat(second.lo()).isCloseTo(0.55, within(1e-9));
        assertThat(second.hi()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void shouldRejectInvertedRange() {
        assertThatThrownBy(() -> new ProgressScaler(0.6, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPrefixToolNameAndDefaultMessage() {
        List<ProgressEvent> received = new ArrayList<>();
        ProgressSink sink = new ProgressScaler(0.3, 0.8).wrap("web_search", received::add);

        sink.report(new ProgressEvent(1, 2.0, "Searching"));
        sink.report(new ProgressEvent(2, 2.0, null));

        assertThat(received)
                .extracting(ProgressEvent::message)
                .containsExactly("[web_search] Searching", "[web_search] Working...");
        assertThat(received.get(0).fraction()).isCloseTo(0.55, within(1e-9));
        assertThat(received.get(1).fraction()).isCloseTo(0.8, within(1e-9));
    }
}
