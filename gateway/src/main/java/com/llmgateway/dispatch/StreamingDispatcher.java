package com.llmgateway.dispatch;

import com.llmgateway.config.GatewayProperties;
import com.llmgateway.credential.CredentialResolver;
import com.llmgateway.credential.ResolvedTarget;
import com.llmgateway.error.ErrorClassifier;
import com.llmgateway.error.NormalizedError;
import com.llmgateway.model.ChatModels.ChatDispatchRequest;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.model.ChatModels.ModelConfiguration;
import com.llmgateway.model.StreamEvent;
import com.llmgateway.provider.WireAdapter;
import com.llmgateway.provider.WireAdapters;
import com.llmgateway.registry.ModelSpec;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.ProviderRegistry;
import com.llmgateway.validation.InvalidConversationException;
import com.llmgateway.validation.ParameterValidator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs one chat request end to end: validate, resolve, connect, relay.
 * <p>
 * The returned stream is cold and emits zero or more deltas followed by
 * exactly one terminal {@code done} or {@code error} event. It never
 * terminates with an error signal. Cancelling the subscription closes the
 * upstream connection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingDispatcher {

    private final ProviderRegistry registry;
    private final ParameterValidator validator;
    private final CredentialResolver credentialResolver;
    private final WireAdapters wireAdapters;
    private final ErrorClassifier classifier;
    private final WebClient upstreamWebClient;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    public Flux<StreamEvent> dispatch(ChatDispatchRequest request) {
        return dispatch(request, state -> {
        });
    }

    /**
     * @param observer notified on every state transition, on whichever thread made it
     */
    public Flux<StreamEvent> dispatch(ChatDispatchRequest request, Consumer<DispatchState> observer) {
        return Flux.defer(() -> {
            DispatchContext context = new DispatchContext(UUID.randomUUID().toString(), observer);
            return Flux.defer(() -> prepare(request, context))
                    .onErrorResume(e -> {
                        NormalizedError error = classifier.classify(e, context.secrets());
                        context.transition(DispatchState.FAILED);
                        return Flux.just(StreamEvent.error(error));
                    })
                    .doOnCancel(() -> context.transition(DispatchState.CANCELLED))
                    .doFinally(signal -> finish(context));
        });
    }

    private Flux<StreamEvent> prepare(ChatDispatchRequest request, DispatchContext context) {
        context.transition(DispatchState.VALIDATING);
        if (request == null || request.model() == null) {
            throw new InvalidConversationException("A model configuration is required", "model");
        }
        ModelConfiguration config = request.model();
        ProviderDescriptor descriptor = registry.describe(config.provider());
        context.providerId(descriptor.id());
        ModelSpec model = descriptor.resolveModel(config.modelId());
        GenerationParameters parameters = request.parametersOrNone();
        validator.validateConversation(request.messages());
        validator.validate(descriptor, model, parameters);

        context.transition(DispatchState.RESOLVING);
        ResolvedTarget target = credentialResolver.resolve(config, descriptor, model);
        context.credential(target.credential());

        context.transition(DispatchState.CONNECTING);
        WireAdapter adapter = wireAdapters.forFormat(descriptor.wireFormat());
        log.info("Dispatch started: requestId={}, provider={}, model={}, messages={}",
                context.requestId(), descriptor.id(), model.id(), request.messages().size());
        return relay(target, adapter, request.messages(), parameters, context);
    }

    private Flux<StreamEvent> relay(ResolvedTarget target, WireAdapter adapter, List<ChatMessage> messages,
                                    GenerationParameters parameters, DispatchContext context) {
        Duration idleTimeout = properties.getStream().getIdleTimeout();
        return upstreamWebClient.post()
                .uri(adapter.streamUri(target))
                .headers(headers -> adapter.writeHeaders(headers, target))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(adapter.requestBody(target, messages, parameters))
                .exchangeToFlux(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return adapter.frames(response);
                    }
                    return response.bodyToMono(String.class)
                            .timeout(properties.getStream().getResponseTimeout(), Mono.just(""))
                            .defaultIfEmpty("")
                            .flatMapMany(body -> Flux.error(UpstreamHttpException.from(
                                    response.statusCode(), body, response.headers().asHttpHeaders())));
                })
                .timeout(idleTimeout)
                .onErrorMap(TimeoutException.class, e -> new StreamIdleException())
                .doOnNext(frame -> context.transition(DispatchState.STREAMING))
                .concatMapIterable(adapter::translate)
                .<StreamEvent>handle((chunk, sink) -> {
                    switch (chunk.kind()) {
                        case TEXT -> sink.next(StreamEvent.delta(chunk.text()));
                        case END -> sink.complete();
                        case FAILURE -> sink.error(new UpstreamStreamException(chunk.text()));
                    }
                })
                // Upstream closing the stream cleanly counts as completion
                .concatWith(Mono.fromSupplier(() -> {
                    context.transition(DispatchState.COMPLETED);
                    return StreamEvent.done();
                }));
    }

    private void finish(DispatchContext context) {
        DispatchState outcome = context.state();
        long elapsed = context.elapsedNanos();
        log.info("Dispatch finished: requestId={}, provider={}, outcome={}, latencyMs={}",
                context.requestId(), context.providerId(), outcome, TimeUnit.NANOSECONDS.toMillis(elapsed));
        meterRegistry.counter("gateway.dispatch",
                "provider", context.providerId(),
                "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        meterRegistry.timer("gateway.dispatch.latency", "provider", context.providerId())
                .record(elapsed, TimeUnit.NANOSECONDS);
    }
}
