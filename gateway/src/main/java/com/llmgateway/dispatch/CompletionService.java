package com.llmgateway.dispatch;

import com.llmgateway.model.ChatModels.ChatDispatchRequest;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.CompletionResponse;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.model.ChatModels.ModelCheckResponse;
import com.llmgateway.model.ChatModels.ModelConfiguration;
import com.llmgateway.model.StreamEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Non-streaming uses of the dispatcher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionService {

    static final String PROBE_MESSAGE = "Test";

    private final StreamingDispatcher dispatcher;

    /**
     * Collects a whole stream into one reply. Text received before a failure
     * is kept alongside the error.
     */
    public Mono<CompletionResponse> complete(ChatDispatchRequest request) {
        return dispatcher.dispatch(request)
                .collectList()
                .map(CompletionService::aggregate);
    }

    /**
     * Sends a one-message probe and stops at the first event. Never fails;
     * problems are reported in the response.
     */
    public Mono<ModelCheckResponse> check(ModelConfiguration model) {
        ChatDispatchRequest probe = new ChatDispatchRequest(
                model, List.of(ChatMessage.user(PROBE_MESSAGE)), GenerationParameters.none());
        return dispatcher.dispatch(probe)
                .next()
                .map(event -> {
                    if (event instanceof StreamEvent.Error error) {
                        log.info("Model check failed: provider={}, model={}, kind={}",
                                model.provider(), model.modelId(), error.error().getKind().wireName());
                        return new ModelCheckResponse(false, error.error().getMessage());
                    }
                    return new ModelCheckResponse(true, "Model configuration is valid");
                })
                .defaultIfEmpty(new ModelCheckResponse(true, "Model configuration is valid"));
    }

    private static CompletionResponse aggregate(List<StreamEvent> events) {
        StringBuilder text = new StringBuilder();
        for (StreamEvent event : events) {
            if (event instanceof StreamEvent.TextDelta delta) {
                text.append(delta.text());
            } else if (event instanceof StreamEvent.Error error) {
                return new CompletionResponse(text.toString(), "error", error.error());
            }
        }
        return new CompletionResponse(text.toString(), "stop", null);
    }
}
