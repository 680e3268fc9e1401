package com.example.cnab.config;

import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.metrics.MicrometerIngestionMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    /**
     * Registro em memória quando nenhum exportador de métricas estiver configurado.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public IngestionMetrics ingestionMetrics(MeterRegistry meterRegistry) {
        return new MicrometerIngestionMetrics(meterRegistry);
    }
}
