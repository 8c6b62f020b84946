/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.application.routing;

import com.consejo.config.AppProperties;
import com.consejo.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Per-provider circuit breaker with exponential backoff.
 *
 * <p>CLOSED trips to OPEN after {@code failureThreshold} consecutive failures. OPEN moves to HALF_OPEN
 * lazily, on the first state read after {@code currentTimeout} has elapsed. HALF_OPEN closes after
 * {@code successThreshold} successes; a single failure reopens it and doubles the timeout up to
 * {@code maxTimeout}.
 *
 * <p>Each provider owns its own {@link ProviderCircuit}; every read-modify-write, including the lazy
 * transition, runs under that circuit's monitor.
 */
@Service
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ConcurrentMap<String, ProviderCircuit> circuits = new ConcurrentHashMap<>();

    @Autowired
    public CircuitBreaker(AppProperties properties, Clock clock) {
        this(CircuitBreakerSettings.from(properties.circuitBreaker()), clock);
    }

    public CircuitBreaker(CircuitBreakerSettings settings, Clock clock) {
        this.settings = settings == null ? CircuitBreakerSettings.defaults() : settings;
        this.clock = clock;
    }

    public CircuitState getState(String provider) {
        ProviderCircuit circuit = circuit(provider);
        synchronized (circuit) {
            return circuit.evaluate(clock.instant());
        }
    }

    public boolean isAvailable(String provider) {
        return getState(provider) != CircuitState.OPEN;
    }

    public void recordSuccess(String provider) {
        ProviderCircuit circuit = circuit(provider);
        synchronized (circuit) {
            CircuitState state = circuit.evaluate(clock.instant());
            if (state == CircuitState.HALF_OPEN) {
                circuit.halfOpenSuccesses++;
                if (circuit.halfOpenSuccesses >= settings.successThreshold()) {
                    circuit.close(settings.baseTimeout());
                    log.info("Circuit closed provider={} after half-open trial", provider);
                }
            } else if (state == CircuitState.CLOSED) {
                circuit.consecutiveFailures = 0;
            }
        }
    }

    public void recordFailure(String provider) {
        ProviderCircuit circuit = circuit(provider);
        synchronized (circuit) {
            Instant now = clock.instant();
            CircuitState state = circuit.evaluate(now);
            circuit.consecutiveFailures++;
            circuit.lastFailureAt = now;

            if (state == CircuitState.HALF_OPEN) {
                Duration doubled = circuit.currentTimeout.multipliedBy(2);
                Duration next = doubled.compareTo(settings.maxTimeout()) > 0 ? settings.maxTimeout() : doubled;
                circuit.open(now, next);
                log.warn("Circuit reopened provider={} from=HALF_OPEN timeout={}", provider, next);
            } else if (state == CircuitState.CLOSED && circuit.consecutiveFailures >= settings.failureThreshold()) {
                circuit.open(now, settings.baseTimeout());
                log.warn("Circuit opened provider={} failures={} timeout={}",
                        provider, circuit.consecutiveFailures, settings.baseTimeout());
            }
        }
    }

    /**
     * Runs {@code operation} against {@code provider}. Rejected calls never reach the operation and are
     * not counted as failures.
     *
     * @throws CircuitOpenException when the breaker is open
     */
    public <T> T call(String provider, Supplier<T> operation) {
        if (!isAvailable(provider)) {
            throw new CircuitOpenException(provider);
        }
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            recordFailure(provider);
            throw e;
        }
        recordSuccess(provider);
        return result;
    }

    public Optional<String> getFallbackProvider(String failedProvider, List<String> candidates) {
        if (candidates == null) return Optional.empty();
        for (String candidate : candidates) {
            if (candidate == null || candidate.equals(failedProvider)) continue;
            if (isAvailable(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    public void reset(String provider) {
        ProviderCircuit removed = circuits.remove(provider);
        if (removed != null) {
            synchronized (removed) {
                removed.close(settings.baseTimeout());
                removed.lastFailureAt = null;
            }
            log.info("Circuit reset provider={}", provider);
        }
    }

    public CircuitStats getStats(String provider) {
        ProviderCircuit circuit = circuits.get(provider);
        if (circuit == null) {
            return new CircuitStats(provider, CircuitState.CLOSED, 0, 0, settings.baseTimeout(), null, null);
        }
        synchronized (circuit) {
            CircuitState state = circuit.evaluate(clock.instant());
            return new CircuitStats(
                    provider,
                    state,
                    circuit.consecutiveFailures,
                    circuit.halfOpenSuccesses,
                    circuit.currentTimeout,
                    circuit.lastFailureAt,
                    circuit.openedAt
            );
        }
    }

    public List<CircuitStats> getAllStats() {
        return circuits.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(this::getStats)
                .toList();
    }

    private ProviderCircuit circuit(String provider) {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
        return circuits.computeIfAbsent(provider, p -> new ProviderCircuit(settings.baseTimeout()));
    }

    private static final class ProviderCircuit {
        private CircuitState phase = CircuitState.CLOSED;
        private int consecutiveFailures;
        private int halfOpenSuccesses;
        private Instant lastFailureAt;
        private Instant openedAt;
        private Duration currentTimeout;

        private ProviderCircuit(Duration baseTimeout) {
            this.currentTimeout = baseTimeout;
        }

        // Caller holds the monitor.
        private CircuitState evaluate(Instant now) {
            if (phase == CircuitState.OPEN && openedAt != null
                    && Duration.between(openedAt, now).compareTo(currentTimeout) >= 0) {
                phase = CircuitState.HALF_OPEN;
                halfOpenSuccesses = 0;
            }
            return phase;
        }

        private void open(Instant now, Duration timeout) {
            phase = CircuitState.OPEN;
            openedAt = now;
            currentTimeout = timeout;
        }

        private void close(Duration baseTimeout) {
            phase = CircuitState.CLOSED;
            consecutiveFailures = 0;
            halfOpenSuccesses = 0;
            currentTimeout = baseTimeout;
        }
    }
}
