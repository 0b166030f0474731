package com.identityplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identityplatform.orchestrator.client.AbstractServiceClient;
import com.identityplatform.orchestrator.client.ChatbotClient;
import com.identityplatform.orchestrator.client.VerifierClient;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One {@link WebClient} per remote service, each with its own Netty connect and response
 * timeouts. The Reactor {@code timeout} inside the clients stays the authoritative bound.
 */
@Configuration
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    @Value("${services.verifier.base-url:http://localhost:5000}")
    private String verifierBaseUrl;

    @Value("${services.verifier.timeout:30s}")
    private Duration verifierTimeout;

    @Value("${services.verifier.connect-timeout:10s}")
    private Duration verifierConnectTimeout;

    @Value("${services.chatbot.base-url:http://localhost:8081}")
    private String chatbotBaseUrl;

    @Value("${services.chatbot.timeout:30s}")
    private Duration chatbotTimeout;

    @Value("${services.chatbot.connect-timeout:10s}")
    private Duration chatbotConnectTimeout;

    @Value("${services.chatbot.provider:deepseek}")
    private String chatbotProvider;

    @Value("${services.chatbot.k:4}")
    private int chatbotTopK;

    @Bean
    public WebClient verifierWebClient(WebClient.Builder builder) {
        return build(builder, verifierBaseUrl, verifierConnectTimeout, verifierTimeout);
    }

    @Bean
    public WebClient chatbotWebClient(WebClient.Builder builder) {
        return build(builder, chatbotBaseUrl, chatbotConnectTimeout, chatbotTimeout);
    }

    @Bean
    public VerifierClient verifierClient(WebClient verifierWebClient, ObjectMapper objectMapper) {
        return new VerifierClient(verifierWebClient, objectMapper);
    }

    @Bean
    public ChatbotClient chatbotClient(WebClient chatbotWebClient, ObjectMapper objectMapper) {
        return new ChatbotClient(chatbotWebClient, objectMapper, chatbotProvider, chatbotTopK);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, Duration connectTimeout, Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .responseTimeout(responseTimeout);

        log.info("Service client configured. baseUrl={} connectTimeout={} responseTimeout={}",
                 baseUrl, connectTimeout, responseTimeout);
        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {} requestId={}", clientRequest.method(), clientRequest.url(),
                      clientRequest.headers().getFirst(AbstractServiceClient.REQUEST_ID_HEADER));
            return Mono.just(clientRequest);
        });
    }
}
