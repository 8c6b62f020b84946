/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Service
public class WebClientProviderProbe implements ProviderProbe {
    private static final Logger log = LoggerFactory.getLogger(WebClientProviderProbe.class);

    private final WebClient probeWebClient;

    public WebClientProviderProbe(@Qualifier("probeWebClient") WebClient probeWebClient) {
        this.probeWebClient = probeWebClient;
    }

    @Override
    public int probe(String provider, String healthUrl, String apiKey, Duration timeout) {
        if (healthUrl == null || healthUrl.isBlank()) {
            throw ProviderException.unreachable(provider, "No health endpoint configured", null);
        }
        try {
            Integer status = probeWebClient.get()
                    .uri(healthUrl)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.setBearerAuth(apiKey);
                        }
                    })
                    .exchangeToMono(res -> res.releaseBody().thenReturn(res.statusCode().value()))
                    .timeout(timeout)
                    .block();
            if (status == null) {
                throw new ProviderException(provider, ProviderErrorType.UNKNOWN, "Empty probe response");
            }
            return status;
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw ProviderException.timeout(provider, cause);
            }
            if (cause instanceof WebClientRequestException) {
                log.debug("Probe connection failed provider={} url={}", provider, healthUrl, cause);
                throw ProviderException.unreachable(provider, describe(cause), cause);
            }
            throw new ProviderException(provider, ProviderErrorType.UNKNOWN, describe(cause), cause);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
