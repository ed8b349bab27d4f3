package com.llmgateway.controller;

import com.llmgateway.dispatch.CompletionService;
import com.llmgateway.model.ChatModels;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1/models")
@RequiredArgsConstructor
public class ModelController {

    private final CompletionService completionService;

    /**
     * Checks a model configuration with a one-message probe.
     */
    @PostMapping("/validate")
    public Mono<ChatModels.ModelCheckResponse> validate(@Valid @RequestBody ChatModels.ModelCheckRequest request) {
        return completionService.check(request.model());
    }
}
