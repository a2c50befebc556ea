package com.bbthechange.chatpolls.config;

import com.bbthechange.chatpolls.client.ChatApiClient;
import com.bbthechange.chatpolls.client.ConnectionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(ChatClientProperties.class)
public class ChatClientConfig {

    private final ChatClientProperties properties;

    public ChatClientConfig(ChatClientProperties properties) {
        this.properties = properties;
    }

    @Bean("chatHttpClient")
    public HttpClient chatHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    /**
     * Request counters go to the application's registry when Actuator provides one, otherwise to a local one.
     */
    @Bean
    public ChatApiClient chatApiClient(@Qualifier("chatHttpClient") HttpClient httpClient,
                                       ObjectMapper objectMapper,
                                       ObjectProvider<MeterRegistry> meterRegistry) {
        return new ChatApiClient(httpClient, objectMapper, properties,
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public ConnectionState connectionState(ChatApiClient chatApiClient) {
        return new ConnectionState(chatApiClient);
    }
}
