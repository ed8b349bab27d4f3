package com.llmgateway.provider;

import com.llmgateway.credential.ResolvedTarget;
import com.llmgateway.model.ChatModels.ChatMessage;
import com.llmgateway.model.ChatModels.GenerationParameters;
import com.llmgateway.registry.WireFormat;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Translation between the gateway's uniform request/stream shapes and one
 * provider dialect. Adapters are stateless and shared across requests.
 */
public interface WireAdapter {

    ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };

    WireFormat format();

    URI streamUri(ResolvedTarget target);

    void writeHeaders(HttpHeaders headers, ResolvedTarget target);

    /**
     * JSON body for the streaming request. Only parameters the caller set are
     * included; they have already been validated against the provider.
     */
    Map<String, Object> requestBody(ResolvedTarget target, List<ChatMessage> messages,
                                    GenerationParameters parameters);

    /**
     * Splits the upstream body into frames. Defaults to SSE data fields.
     */
    default Flux<String> frames(ClientResponse response) {
        return response.bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .filter(data -> !data.isBlank());
    }

    /**
     * Decodes one frame. A frame may carry nothing of interest (keep-alives,
     * metadata), in which case the list is empty.
     */
    List<UpstreamChunk> translate(String frame);
}
