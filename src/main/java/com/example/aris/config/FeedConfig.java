package com.example.aris.config;

import com.example.aris.processor.FeedPostProcessor;
import com.example.aris.service.FeedEngineOptions;
import com.example.aris.session.FeedSourceProvider;
import com.example.aris.session.UserSessionManager;
import com.example.aris.source.location.LocationSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class FeedConfig {

    @Bean
    public FeedEngineOptions feedEngineOptions(FeedProperties properties, ObjectMapper objectMapper, Validator validator) {
        return FeedEngineOptions.builder()
                .cacheTtl(properties.getCacheTtl())
                .itemTimeout(properties.getItemTimeout())
                .objectMapper(objectMapper)
                .validator(validator)
                .build();
    }

    @Bean
    public FeedSourceProvider locationSourceProvider(FeedProperties properties) {
        int historySize = properties.getLocation().getHistorySize();
        return userId -> new LocationSource(historySize);
    }

    @Bean(destroyMethod = "shutdown")
    public UserSessionManager userSessionManager(List<FeedSourceProvider> providers,
                                                 ObjectProvider<FeedPostProcessor> processors,
                                                 FeedEngineOptions feedEngineOptions) {
        return new UserSessionManager(providers, () -> processors.orderedStream().toList(), feedEngineOptions);
    }
}
