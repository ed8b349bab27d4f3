package com.llmgateway.config;

import com.llmgateway.credential.CredentialStore;
import com.llmgateway.credential.InMemoryCredentialStore;
import com.llmgateway.registry.ProviderCatalog;
import com.llmgateway.registry.ProviderDescriptor;
import com.llmgateway.registry.ProviderRegistry;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.List;

@Slf4j
@Configuration
public class GatewayConfig {

    /**
     * The built-in catalog minus providers switched off for this deployment.
     */
    @Bean
    public ProviderRegistry providerRegistry(GatewayProperties properties) {
        List<ProviderDescriptor> enabled = ProviderCatalog.defaults().stream()
                .filter(descriptor -> properties.providerSettings(descriptor.id()).isEnabled())
                .toList();
        log.info("Provider registry loaded: providers={}",
                enabled.stream().map(ProviderDescriptor::id).toList());
        return new ProviderRegistry(enabled);
    }

    @Bean
    public CredentialStore credentialStore(GatewayProperties properties) {
        log.info("Credential store loaded: references={}", properties.getCredentials().size());
        return new InMemoryCredentialStore(properties.getCredentials());
    }

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, GatewayProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) properties.getStream().getConnectTimeout().toMillis());
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
