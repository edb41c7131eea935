package com.officehub.backend.global.config;

import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ActuatorConfig {

    private static final int EXCHANGE_CAPACITY = 100;

    /**
     * Backs the {@code /actuator/httpexchanges} endpoint with a bounded in-memory buffer.
     */
    @Bean
    public HttpExchangeRepository httpExchangeRepository() {
        InMemoryHttpExchangeRepository repository = new InMemoryHttpExchangeRepository();
        repository.setCapacity(EXCHANGE_CAPACITY);
        return repository;
    }
}
