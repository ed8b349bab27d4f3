package com.llmgateway.dispatch;

import com.llmgateway.config.GatewayProperties;
import com.llmgateway.error.ErrorKind;
import com.llmgateway.error.NormalizedError;
import com.llmgateway.model.ChatModels.ChatDispatchRequest;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.model.ChatModels.ModelConfiguration;
import com.llmgateway.model.StreamEvent;
import com.llmgateway.support.StubUpstream;
import com.llmgateway.support.TestProviders;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingDispatcherTest {

    private StubUpstream upstream;
    private GatewayProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private StreamingDispatcher dispatcher;
    private List<DispatchState> states;

    @BeforeEach
    void setUp() {
        upstream = new StubUpstream();
        properties = TestProviders.properties();
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = TestProviders.dispatcher(upstream, properties, meterRegistry);
        states = new CopyOnWriteArrayList<>();
    }

    @Test
    @DisplayName("should stream deltas in order and finish with one done event")
    void shouldStreamDeltasThenDone() {
        upstream.respondSse(
                "{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}",
                "[DONE]");

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", "alpha-large", null), states::add))
                .expectNext(StreamEvent.delta("Hel"))
                .expectNext(StreamEvent.delta("lo"))
                .expectNext(StreamEvent.done())
                .verifyComplete();

        assertThat(states).containsExactly(
                DispatchState.VALIDATING, DispatchState.RESOLVING, DispatchState.CONNECTING,
                DispatchState.STREAMING, DispatchState.COMPLETED);
        assertThat(upstream.calls()).isEqualTo(1);
        ClientRequest sent = upstream.requests().get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("https://alpha.test/v1/chat/completions");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer " + TestProviders.ALPHA_KEY);
        assertThat(meterRegistry.counter("gateway.dispatch", "provider", "alpha", "outcome", "completed").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a clean end of stream without a sentinel as completion")
    void shouldCompleteOnCleanClose() {
        upstream.respondSse("{\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}");

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .expectNext(StreamEvent.delta("ok"))
                .expectNext(StreamEvent.done())
                .verifyComplete();
    }

    @Test
    @DisplayName("should reject out-of-range temperature without touching the network")
    void shouldRejectTemperatureBeforeNetwork() {
        GenerationParameters parameters = GenerationParameters.builder().temperature(5.0).build();

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", "alpha-large", parameters), states::add))
                .assertNext(event -> {
                    NormalizedError error = ((StreamEvent.Error) event).error();
                    assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
                    assertThat(error.getParam()).isEqualTo("temperature");
                    assertThat(error.getMessage()).contains("temperature", "5.0", "[0,1]");
                })
                .verifyComplete();

        assertThat(upstream.calls()).isZero();
        assertThat(states).containsExactly(DispatchState.VALIDATING, DispatchState.FAILED);
    }

    @Test
    @DisplayName("should reject an unknown provider as an invalid request")
    void shouldRejectUnknownProvider() {
        StepVerifier.create(dispatcher.dispatch(TestProviders.request("nope", null, null)))
                .assertNext(event -> {
                    NormalizedError error = ((StreamEvent.Error) event).error();
                    assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
                    assertThat(error.getParam()).isEqualTo("provider");
                })
                .verifyComplete();
        assertThat(upstream.calls()).isZero();
    }

    @Test
    @DisplayName("should reject a model outside the provider catalog")
    void shouldRejectUnknownModel() {
        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", "beta-huge", null)))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getKind())
                        .isEqualTo(ErrorKind.MODEL_NOT_FOUND))
                .verifyComplete();
        assertThat(upstream.calls()).isZero();
    }

    @Test
    @DisplayName("should fail as authentication when no credential resolves")
    void shouldFailWithoutCredential() {
        properties.getProviders().clear();

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null), states::add))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getKind())
                        .isEqualTo(ErrorKind.AUTHENTICATION))
                .verifyComplete();

        assertThat(upstream.calls()).isZero();
        assertThat(states).containsExactly(DispatchState.VALIDATING, DispatchState.RESOLVING, DispatchState.FAILED);
    }

    @Test
    @DisplayName("should reject an empty conversation")
    void shouldRejectEmptyConversation() {
        ChatDispatchRequest request = new ChatDispatchRequest(
                ModelConfiguration.builder().provider("alpha").build(), List.of(), null);

        StepVerifier.create(dispatcher.dispatch(request))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getParam()).isEqualTo("messages"))
                .verifyComplete();
        assertThat(upstream.calls()).isZero();
    }

    @Test
    @DisplayName("should classify HTTP 429 as rate-limit with the advertised retry hint")
    void shouldClassifyRateLimit() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "20");
        upstream.respondStatus(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"code\":\"rate_limit_exceeded\",\"message\":\"Rate limit reached for requests\"}}",
                headers);

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .assertNext(event -> {
                    NormalizedError error = ((StreamEvent.Error) event).error();
                    assertThat(error.getKind()).isEqualTo(ErrorKind.RATE_LIMIT);
                    assertThat(error.getRetryAfter()).isEqualTo(20L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should fall back to the default retry hint when upstream gives none")
    void shouldDefaultRetryHint() {
        upstream.respondStatus(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"code\":\"rate_limit_exceeded\"}}", new HttpHeaders());

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getRetryAfter()).isEqualTo(60L))
                .verifyComplete();
    }

    @Test
    @DisplayName("should keep delivered deltas and end with an error raised mid-stream")
    void shouldEndWithMidStreamError() {
        upstream.respondSse(
                "{\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}",
                "{\"error\":{\"type\":\"server_error\",\"message\":\"The server is overloaded\"}}",
                "{\"choices\":[{\"delta\":{\"content\":\"never seen\"}}]}");

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null), states::add))
                .expectNext(StreamEvent.delta("partial"))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getKind())
                        .isEqualTo(ErrorKind.SERVICE_UNAVAILABLE))
                .verifyComplete();

        assertThat(states).endsWith(DispatchState.STREAMING, DispatchState.FAILED);
    }

    @Test
    @DisplayName("should fail as service-unavailable when upstream goes silent")
    void shouldTimeOutIdleStream() {
        upstream.respondSseThenHang("{\"choices\":[{\"delta\":{\"content\":\"first\"}}]}");

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .expectNext(StreamEvent.delta("first"))
                .assertNext(event -> {
                    NormalizedError error = ((StreamEvent.Error) event).error();
                    assertThat(error.getKind()).isEqualTo(ErrorKind.SERVICE_UNAVAILABLE);
                    assertThat(error.getRetryAfter()).isEqualTo(30L);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should close the upstream stream when the caller cancels")
    void shouldPropagateCancellation() {
        upstream.respondEndlessSse(Duration.ofMillis(10));

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null), states::add))
                .expectNextCount(3)
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(upstream.cancelled()).isTrue();
        assertThat(states).last().isEqualTo(DispatchState.CANCELLED);
        assertThat(meterRegistry.counter("gateway.dispatch", "provider", "alpha", "outcome", "cancelled").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should classify a refused connection as a network error")
    void shouldClassifyConnectionFailure() {
        upstream.fail(new ConnectException("Connection refused: alpha.test/10.0.0.1:443"));

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getKind())
                        .isEqualTo(ErrorKind.NETWORK_ERROR))
                .verifyComplete();
    }

    @Test
    @DisplayName("should classify an undecodable frame as an invalid request")
    void shouldClassifyMalformedFrame() {
        upstream.respondSse("{not json");

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .assertNext(event -> assertThat(((StreamEvent.Error) event).error().getKind())
                        .isEqualTo(ErrorKind.INVALID_REQUEST))
                .verifyComplete();
    }

    @Test
    @DisplayName("should never echo the resolved credential in an error")
    void shouldNotLeakCredential() {
        upstream.respondStatus(HttpStatus.UNAUTHORIZED,
                "{\"error\":{\"message\":\"Incorrect API key provided: " + TestProviders.ALPHA_KEY + "\"}}",
                new HttpHeaders());

        StepVerifier.create(dispatcher.dispatch(TestProviders.request("alpha", null, null)))
                .assertNext(event -> {
                    NormalizedError error = ((StreamEvent.Error) event).error();
                    assertThat(error.getKind()).isEqualTo(ErrorKind.AUTHENTICATION);
                    assertThat(error.getMessage()).doesNotContain(TestProviders.ALPHA_KEY);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should stream NDJSON from a credential-free provider")
    void shouldStreamNdjson() {
        upstream.respondNdjson(
                "{\"message\":{\"role\":\"assistant\",\"content\":\"Hi\"},\"done\":false}",
                "{\"message\":{\"role\":\"assistant\",\"content\":\" there\"},\"done\":false}",
                "{\"message\":{\"role\":\"assistant\",\"content\":\"\"},\"done\":true}");

        ChatDispatchRequest request = new ChatDispatchRequest(
                ModelConfiguration.builder().provider("local").modelId("mistral:7b").build(),
                List.of(ChatMessage.system("Be brief."), ChatMessage.user("hi")),
                null);

        StepVerifier.create(dispatcher.dispatch(request))
                .expectNext(StreamEvent.delta("Hi"))
                .expectNext(StreamEvent.delta(" there"))
                .expectNext(StreamEvent.done())
                .verifyComplete();

        ClientRequest sent = upstream.requests().get(0);
        assertThat(sent.url().toString()).isEqualTo("http://localhost:11434/api/chat");
        assertThat(sent.headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }
}
