package com.vcdcli.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * A Spring configuration class responsible for the shared HTTP client setup.
 * The builder defined here is the template from which every per-session vCloud client is cloned.
 */
@Configuration
@Slf4j
public class HttpClientFactory {

    /**
     * Creates the base {@link WebClient.Builder} used to talk to vCloud Director.
     * <p>
     * Requests are never retried: each command issues its remote call once and reports whatever
     * the server answered. Request and response lines are traced at DEBUG level.
     *
     * @return A builder that callers must {@link WebClient.Builder#clone() clone} before customizing.
     */
    @Bean
    public WebClient.Builder vcdWebClientBuilder() {
        return WebClient.builder()
                .filter(ExchangeFilterFunction.ofRequestProcessor(request -> {
                    log.debug("{} {}", request.method(), request.url());
                    return Mono.just(request);
                }))
                .filter(ExchangeFilterFunction.ofResponseProcessor(response -> {
                    log.debug("Response status {}", response.statusCode());
                    return Mono.just(response);
                }));
    }
}
