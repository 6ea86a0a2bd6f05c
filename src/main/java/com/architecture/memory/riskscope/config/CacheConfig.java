package com.architecture.memory.riskscope.config;

import com.architecture.memory.riskscope.service.cache.CaffeineSignalCache;
import com.architecture.memory.riskscope.service.cache.NoOpSignalCache;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public SignalCache signalCache(RiskScopeProperties properties) {
        RiskScopeProperties.Cache cache = properties.getCache();
        if (!cache.isEnabled()) {
            log.info("[Cache] Signal cache disabled, every signal is computed on demand");
            return new NoOpSignalCache();
        }
        return new CaffeineSignalCache(cache.getMaximumSize());
    }
}
