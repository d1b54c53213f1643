package com.aim.scraper.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Binds the remote model endpoint settings from <code>application.yml</code>
 * under the <code>aim</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * aim:
 *   page-url: https://www.aim.env.uea.ac.uk/aim/model2/model2a.php
 *   user-agent: Mozilla/5.0 (...)
 *   timeout: 30s
 * }</pre>
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "aim")
public class AimProperties {

    /**
     * Page that carries the model form; discovery GETs it and the fallback
     * submission POSTs to it.
     */
    @NotBlank
    private String pageUrl = "https://www.aim.env.uea.ac.uk/aim/model2/model2a.php";

    /**
     * Fixed user-agent sent with every request of a session.
     */
    @NotBlank
    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/117.0.0.0 Safari/537.36";

    /**
     * Default timeout of a single network call when the caller supplies none.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * TCP connect timeout of the underlying client.
     */
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(20);

    /**
     * Largest response body buffered in memory, in bytes.
     */
    @Min(1024)
    private int maxInMemorySize = 4 * 1024 * 1024;

    /**
     * Characters of response text kept when nothing structured was recognised.
     */
    @Min(1)
    private int rawExcerptLimit = 2000;

    /**
     * @return {@link #pageUrl} as a URI
     */
    public URI pageUri() {
        return URI.create(pageUrl.trim());
    }
}
