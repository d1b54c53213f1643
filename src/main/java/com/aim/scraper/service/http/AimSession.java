package com.aim.scraper.service.http;

import com.aim.scraper.model.Payload;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One browser-like conversation with the model page.
 * <p>
 * Cookies set by any response are replayed on every later request of the same
 * session, including those set on redirect hops, so state the server creates
 * on the first GET is still there when the form is posted. Sessions are cheap
 * and must not be shared between runs.
 * </p>
 */
@Slf4j
public class AimSession {

    static final int MAX_REDIRECTS = 10;

    /** Page the session was opened for; also the {@code Referer} of submissions. */
    @Getter
    private final URI pageUrl;

    private final Map<String, String> cookies = new ConcurrentHashMap<>();

    private final WebClient client;

    AimSession(final URI pageUrl, final WebClient.Builder builder, final String userAgent) {
        this.pageUrl = pageUrl;
        this.client = builder.clone()
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .filter(saveCookies())
                .filter(replayCookies())
                .build();
    }

    /**
     * GETs the page this session was opened for, following redirects.
     *
     * @throws NetworkException on timeout, connection failure or non-2xx status
     */
    public String fetchPage(final Duration timeout) {
        return execute("GET", pageUrl, send(HttpMethod.GET, pageUrl, null, 0), timeout);
    }

    /**
     * POSTs {@code payload} form-urlencoded to {@code actionUrl} with the
     * session page as {@code Referer}. A 301/302/303 answer is followed with a
     * GET, a 307/308 answer repeats the POST.
     *
     * @throws NetworkException on timeout, connection failure or non-2xx status
     */
    public String postForm(final URI actionUrl, final Payload payload, final Duration timeout) {
        return execute("POST", actionUrl, send(HttpMethod.POST, actionUrl, payload, 0), timeout);
    }

    /**
     * One hop of a request. Redirects are followed here rather than by the
     * connector so that every hop passes the cookie filters.
     */
    private Mono<String> send(final HttpMethod method, final URI uri, final Payload payload, final int hop) {
        if (hop > MAX_REDIRECTS) {
            return Mono.error(new NetworkException("Too many redirects, last was " + uri, null));
        }
        WebClient.RequestHeadersSpec<?> request = HttpMethod.POST.equals(method)
                ? client.post().uri(uri)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .header(HttpHeaders.REFERER, pageUrl.toString())
                        .body(BodyInserters.fromFormData(payload.toFormData()))
                : client.get().uri(uri);
        return request.exchangeToMono(rsp -> {
            URI location = rsp.headers().asHttpHeaders().getLocation();
            if (rsp.statusCode().is3xxRedirection() && location != null) {
                URI next = uri.resolve(location);
                HttpMethod nextMethod = keepsMethod(rsp.statusCode().value()) ? method : HttpMethod.GET;
                log.debug("{} {} redirected to {}", method, uri, next);
                return rsp.releaseBody().then(send(nextMethod, next, payload, hop + 1));
            }
            if (!rsp.statusCode().is2xxSuccessful()) {
                return rsp.<String>createError();
            }
            return rsp.bodyToMono(String.class).defaultIfEmpty("");
        });
    }

    private static boolean keepsMethod(final int status) {
        return status == HttpStatus.TEMPORARY_REDIRECT.value() || status == HttpStatus.PERMANENT_REDIRECT.value();
    }

    /** Cookies currently held by the session. */
    public Map<String, String> cookies() {
        return Map.copyOf(cookies);
    }

    private String execute(final String method, final URI uri, final Mono<String> call, final Duration timeout) {
        try {
            String body = call.timeout(timeout).block();
            return body == null ? "" : body;
        } catch (NetworkException ex) {
            throw ex;
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            throw new NetworkException(method + " " + uri + " returned HTTP " + status, status, ex);
        } catch (RuntimeException ex) {
            throw new NetworkException(method + " " + uri + " failed: " + ex.getMessage(), ex);
        }
    }

    private ExchangeFilterFunction saveCookies() {
        return ExchangeFilterFunction.ofResponseProcessor(rsp -> {
            rsp.cookies().values().stream()
                    .flatMap(Collection::stream)
                    .forEach(c -> {
                        String previous = cookies.put(c.getName(), c.getValue());
                        if (!c.getValue().equals(previous)) {
                            log.debug("Session cookie {} set", c.getName());
                        }
                    });
            return Mono.just(rsp);
        });
    }

    private ExchangeFilterFunction replayCookies() {
        return (req, next) -> next.exchange(ClientRequest.from(req)
                .cookies(c -> cookies.forEach(c::set))
                .build());
    }
}
