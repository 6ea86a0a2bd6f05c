package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.dto.risk.SignalStatus;
import com.architecture.memory.riskscope.service.cache.CacheKeys;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphRetry;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-or-compute template shared by every signal. Only COMPUTED results are cached;
 * an UNKNOWN is retried on the next request.
 */
@Slf4j
public abstract class AbstractCachedSignalCalculator implements SignalCalculator {

    private final SignalCache cache;
    private final Duration ttl;

    protected AbstractCachedSignalCalculator(SignalCache cache, Duration ttl) {
        this.cache = cache;
        this.ttl = ttl;
    }

    @Override
    public SignalResult calculate(String filePath) {
        SignalName name = name();
        String key = CacheKeys.signal(name, filePath);
        Optional<SignalResult> cached = cache.get(key, SignalResult.class);
        if (cached.isPresent()) {
            log.debug("[Signal] Cache hit {}", key);
            return cached.get();
        }

        SignalResult result;
        try {
            result = GraphRetry.retryOnce(name.getWireName(), () -> compute(filePath));
        } catch (GraphUnavailableException e) {
            log.warn("[Signal] {} for {} unknown after retry: {}", name.getWireName(), filePath, e.getMessage());
            return SignalResult.unknown(name, filePath, "graph store unavailable");
        }

        if (result.getStatus() == SignalStatus.COMPUTED) {
            cache.set(key, result, ttl);
        }
        return result;
    }

    /**
     * Reads the graph and builds the result. May throw {@link GraphUnavailableException}.
     */
    protected abstract SignalResult compute(String filePath);

    protected SignalResult.SignalResultBuilder computed(String filePath, double value,
                                                        RiskLevel level) {
        return SignalResult.builder()
                .name(name())
                .filePath(filePath)
                .status(SignalStatus.COMPUTED)
                .value(value)
                .signalLevel(level);
    }
}
