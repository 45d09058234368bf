package io.pockethive.httpmock.handler;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InFlightTrackerTest {

    private final InFlightTracker tracker = new InFlightTracker();

    @Test
    void idleTrackerReturnsImmediately() throws Exception {
        assertThat(tracker.awaitIdle(Duration.ZERO)).isTrue();
    }

    @Test
    void timesOutWhileRequestsAreActive() throws Exception {
        tracker.begin();

        assertThat(tracker.awaitIdle(Duration.ofMillis(20))).isFalse();
        assertThat(tracker.active()).isEqualTo(1);
    }

    @Test
    void wakesUpWhenLastRequestEnds() throws Exception {
        tracker.begin();
        tracker.begin();
        CompletableFuture<Boolean> drained = CompletableFuture.supplyAsync(() -> {
            try {
                return tracker.awaitIdle(Duration.ofSeconds(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        tracker.end();
        tracker.end();

        assertThat(drained.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(tracker.active()).isZero();
    }

    @Test
    void extraEndDoesNotGoNegative() {
        tracker.end();

        assertThat(tracker.active()).isZero();
    }
}
