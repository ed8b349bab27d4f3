package com.llmgateway.controller;

import com.llmgateway.model.CatalogModels.ModelView;
import com.llmgateway.model.CatalogModels.ProviderView;
import com.llmgateway.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Provider table lookups. Conditional-GET headers are added by the cache filter.
 */
@RestController
@RequestMapping("/v1/providers")
@RequiredArgsConstructor
public class CatalogController {

    private final ProviderRegistry registry;

    @GetMapping
    public Mono<List<ProviderView>> providers() {
        return Mono.fromSupplier(() -> registry.all().stream().map(ProviderView::of).toList());
    }

    @GetMapping("/{id}")
    public Mono<ProviderView> provider(@PathVariable String id) {
        return Mono.fromSupplier(() -> ProviderView.of(registry.describe(id)));
    }

    @GetMapping("/{id}/models")
    public Mono<List<ModelView>> models(@PathVariable String id) {
        return Mono.fromSupplier(() -> registry.describe(id).models().stream().map(ModelView::of).toList());
    }
}
