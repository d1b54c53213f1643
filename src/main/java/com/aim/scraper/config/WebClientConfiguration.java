package com.aim.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

/**
 * Shared {@link WebClient.Builder} for talking to the model page.
 * <p>
 * Sessions clone this builder and add their own cookie handling, so nothing
 * session-specific is configured here. Response timeouts are per call and
 * redirects are followed hop by hop, both by the session.
 * </p>
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    @Bean
    public WebClient.Builder webClientBuilder(final AimProperties props) {
        return builderFor(props);
    }

    /**
     * Builds the connector, codecs and logging filters from the given settings.
     * Usable without a Spring context.
     */
    public static WebClient.Builder builderFor(final AimProperties props) {

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(props.getMaxInMemorySize()))
                .build();

        HttpClient tcpClient = HttpClient.create()
                .protocol(HttpProtocol.HTTP11)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.getConnectTimeout().toMillis())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT,
                        MediaType.TEXT_HTML_VALUE + ", " + MediaType.TEXT_PLAIN_VALUE + ", */*;q=0.8")
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().contentType().orElse(null));
            return Mono.just(res);
        });
    }
}
