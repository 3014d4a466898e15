package io.nexus.server.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.nexus.core.Router;
import io.nexus.core.progress.ProgressEvent;
import io.nexus.core.progress.ProgressSink;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryProgressStreamTest {

    private Router router;
    private QueryProgressStream stream;

    @BeforeEach
    void setUp() {
        router = mock(Router.class);
        stream = new QueryProgressStream(router, Runnable::run);
    }

    @Test
    void shouldEmitProgressThenCompleted() {
        when(router.processQuery(eq("weather?"), any(ProgressSink.class)))
                .thenAnswer(
                        invocation -> {
                            ProgressSink sink = invocation.getArgument(1);
                            sink.report(0.1, "Analyzing query and planning tool calls...");
                            sink.report(new ProgressEvent(0.5, 1.0, "[search] Searching"));
                            sink.report(1.0, "Complete!");
                            return "Sunny";
                        });

        AssertSubscriber<QueryEvent> subscriber =
                stream.stream("weather?").subscribe().withSubscriber(AssertSubscriber.create(10));
        subscriber.awaitCompletion();

        assertThat(subscriber.getItems())
                .containsExactly(
                        new QueryEvent.Progress(0.1, 1.0, "Analyzing query and planning tool calls..."),
                        new QueryEvent.Progress(0.5, 1.0, "[search] Searching"),
                        new QueryEvent.Progress(1.0, 1.0, "Complete!"),
                        new QueryEvent.Completed("Sunny"));
        assertThat(subscriber.getItems()).extracting(QueryEvent::type)
                .containsExactly("progress", "progress", "progress", "completed");
    }

    @Test
    void shouldEndWithErrorEventOnUnexpectedFailure() {
        when(router.processQuery(eq("boom"), any(ProgressSink.class)))
                .thenThrow(new IllegalStateException("executor shut down"));

        AssertSubscriber<QueryEvent> subscriber =
                stream.stream("boom").subscribe().withSubscriber(AssertSubscriber.create(10));
        subscriber.awaitCompletion();

        assertThat(subscriber.getItems())
                .containsExactly(new QueryEvent.Failed("Internal server error"));
    }

    @Test
    void shouldDropEventsAfterCancellation() {
        AtomicReference<AssertSubscriber<QueryEvent>> ref = new AtomicReference<>();
        when(router.processQuery(eq("leave"), any(ProgressSink.class)))
                .thenAnswer(
                        invocation -> {
                            ProgressSink sink = invocation.getArgument(1);
                            sink.report(0.1, "first");
                            ref.get().cancel();
                            sink.report(0.5, "second");
                            return "discarded";
                        });

        AssertSubscriber<QueryEvent> subscriber = AssertSubscriber.create(10);
        ref.set(subscriber);
        stream.stream("leave").subscribe().withSubscriber(subscriber);

        assertThat(subscriber.getItems())
                .containsExactly(new QueryEvent.Progress(0.1, 1.0, "first"));
        subscriber.assertNotTerminated();
        verify(router).processQuery(eq("leave"), any(ProgressSink.class));
    }

    @Test
    void shouldNotRunQueryUntilSubscribed() {
        stream.stream("lazy");

        verifyNoInteractions(router);
    }
}
