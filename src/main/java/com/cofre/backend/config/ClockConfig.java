package com.cofre.backend.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Relógio único da aplicação. O status dos orçamentos e as datas da poupança são
 * calculados a partir dele, o que permite fixar o "agora" nos testes.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${cofre.timezone:America/Sao_Paulo}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
