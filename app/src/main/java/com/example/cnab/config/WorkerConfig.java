package com.example.cnab.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
public class WorkerConfig {

    /**
     * Relógio no fuso de referência dos arquivos; define o "hoje" da validação de datas futuras.
     */
    @Bean
    public Clock clock(@Value("${app.ingestion.zone-id:America/Sao_Paulo}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
