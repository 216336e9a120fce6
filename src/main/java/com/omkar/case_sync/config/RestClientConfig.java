package com.omkar.case_sync.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate intempusRestTemplate(RestTemplateBuilder builder, IntempusConfig intempusConfig) {
        return builder
                .setConnectTimeout(intempusConfig.getTimeout())
                .setReadTimeout(intempusConfig.getTimeout())
                .defaultHeader(HttpHeaders.AUTHORIZATION, intempusConfig.getAuthorization())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
