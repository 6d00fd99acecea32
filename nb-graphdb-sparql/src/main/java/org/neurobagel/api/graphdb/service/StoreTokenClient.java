package org.neurobagel.api.graphdb.service;

import java.time.Duration;

import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import org.neurobagel.api.core.exception.QueryException;
import org.neurobagel.api.core.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;

/**
 * Obtains bearer tokens from the graph store's token endpoint. The {@link WebClient} is expected to carry
 * the token endpoint as base URL and the service's basic authentication.
 */
@Slf4j
public class StoreTokenClient {

    private final WebClient webClient;
    private final Duration timeout;

    public StoreTokenClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    /**
     * Requests a new token.
     *
     * @return the token
     * @throws UnauthorizedException if the store rejects the basic credentials
     * @throws QueryException if no token could be obtained otherwise
     */
    public String fetchToken() {
        log.debug("fetchToken.enter");
        TokenResponse response;
        try {
            response = webClient.get()
                .retrieve()
                .bodyToMono(TokenResponse.class)
                .block(timeout);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                log.error("fetchToken; graph store rejected the configured credentials: {}", status);
                throw new UnauthorizedException("graph store rejected the configured credentials", e);
            }
            log.error("fetchToken; token endpoint answered with status {}", status);
            throw new QueryException("could not obtain a graph store token, status " + status, e);
        } catch (WebClientRequestException e) {
            log.error("fetchToken; token endpoint not reachable: {}", e.getMessage());
            throw new QueryException("graph store token endpoint is not reachable: " + e.getMessage(), e);
        }
        if (response == null || response.token() == null || response.token().isBlank()) {
            throw new QueryException("graph store token endpoint returned no token");
        }
        log.debug("fetchToken.exit; got token");
        return response.token();
    }

    public record TokenResponse(String token) {
    }
}
