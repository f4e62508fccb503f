package com.civicintel.servicerequest.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate socrataRestTemplate(RestTemplateBuilder builder, IngestProperties properties) {
        return builder
                .setConnectTimeout(properties.api().connectTimeout())
                .setReadTimeout(properties.api().readTimeout())
                .build();
    }

    /** Ingestion windows are computed in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
