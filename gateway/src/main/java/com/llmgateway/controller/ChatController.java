package com.llmgateway.controller;

import com.llmgateway.dispatch.CompletionService;
import com.llmgateway.dispatch.StreamingDispatcher;
import com.llmgateway.model.ChatModels;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final StreamingDispatcher dispatcher;
    private final CompletionService completionService;

    /**
     * Streaming chat. Every failure, including a bad request, arrives as the
     * final {@code error} frame of the stream.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@RequestBody ChatModels.ChatDispatchRequest request) {
        return dispatcher.dispatch(request)
                .map(event -> ServerSentEvent.builder(event.payload())
                        .event(event.type())
                        .build());
    }

    /**
     * Non-streaming chat: the same pipeline, collected into one reply.
     */
    @PostMapping("/completions")
    public Mono<ResponseEntity<ChatModels.CompletionResponse>> complete(
            @Valid @RequestBody ChatModels.ChatDispatchRequest request) {
        return completionService.complete(request)
                .map(response -> response.error() == null
                        ? ResponseEntity.ok(response)
                        : ResponseEntity.status(response.error().getKind().httpStatus()).body(response));
    }
}
