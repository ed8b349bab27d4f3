package com.llmgateway.cache;

import com.llmgateway.config.GatewayProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.http.server.reactive.ServerHttpResponseDecorator;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Conditional GET support for read-only endpoints. The handler always runs;
 * this filter only decides whether its body is sent or replaced by a 304.
 */
@Slf4j
@Component
public class CacheHeadersFilter implements WebFilter {

    private final boolean enabled;
    private final CachePolicies policies;
    private final MeterRegistry meterRegistry;

    public CacheHeadersFilter(GatewayProperties properties, MeterRegistry meterRegistry) {
        this.enabled = properties.getCache().isEnabled();
        this.policies = CachePolicies.from(properties.getCache());
        this.meterRegistry = meterRegistry;
        log.info("Cache headers filter: enabled={}, policies={}", enabled, policies.size());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!enabled || !HttpMethod.GET.equals(request.getMethod())) {
            return chain.filter(exchange);
        }
        Optional<CachePolicy> policy = policies.match(request.getPath().pathWithinApplication());
        if (policy.isEmpty()) {
            return chain.filter(exchange);
        }
        ServerHttpResponse response = new ValidatingResponse(exchange.getResponse(), request, policy.get());
        return chain.filter(exchange.mutate().response(response).build());
    }

    private class ValidatingResponse extends ServerHttpResponseDecorator {

        private final ServerHttpRequest request;
        private final CachePolicy policy;

        ValidatingResponse(ServerHttpResponse delegate, ServerHttpRequest request, CachePolicy policy) {
            super(delegate);
            this.request = request;
            this.policy = policy;
        }

        @Override
        public Mono<Void> writeWith(Publisher<? extends DataBuffer> body) {
            HttpStatusCode status = getStatusCode();
            if (status != null && !status.is2xxSuccessful()) {
                return super.writeWith(body);
            }
            return DataBufferUtils.join(body)
                    .flatMap(joined -> {
                        byte[] bytes = new byte[joined.readableByteCount()];
                        joined.read(bytes);
                        DataBufferUtils.release(joined);
                        return respond(bytes);
                    })
                    .switchIfEmpty(Mono.defer(() -> respond(new byte[0])));
        }

        private Mono<Void> respond(byte[] bytes) {
            String tag = ContentValidator.compute(bytes);
            HttpHeaders headers = getHeaders();
            headers.setETag(tag);
            headers.setCacheControl(policy.cacheControl());

            List<String> ifNoneMatch = request.getHeaders().get(HttpHeaders.IF_NONE_MATCH);
            if (ContentValidator.matches(tag, ifNoneMatch)) {
                log.debug("Not modified: path={}, etag={}", request.getPath().value(), tag);
                meterRegistry.counter("gateway.cache", "result", "not_modified").increment();
                setStatusCode(HttpStatus.NOT_MODIFIED);
                headers.remove(HttpHeaders.CONTENT_LENGTH);
                return getDelegate().setComplete();
            }
            meterRegistry.counter("gateway.cache", "result", "full").increment();
            headers.setContentLength(bytes.length);
            return getDelegate().writeWith(Flux.just(bufferFactory().wrap(bytes)));
        }
    }
}
