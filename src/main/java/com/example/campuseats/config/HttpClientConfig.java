package com.example.campuseats.config;

import com.example.campuseats.domain.menu.CatalogProperties;
import com.example.campuseats.global.client.gemini.GeminiProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    @Qualifier("geminiRestTemplate")
    public RestTemplate geminiRestTemplate(RestTemplateBuilder builder, GeminiProperties geminiProperties) {
        return builder
                .rootUri(geminiProperties.url())
                .setConnectTimeout(geminiProperties.connectTimeout())
                .setReadTimeout(geminiProperties.readTimeout())
                .build();
    }

    @Bean
    @Qualifier("catalogRestTemplate")
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, CatalogProperties catalogProperties) {
        return builder
                .rootUri(catalogProperties.baseUrl())
                .setConnectTimeout(catalogProperties.timeout())
                .setReadTimeout(catalogProperties.timeout())
                .build();
    }
}
