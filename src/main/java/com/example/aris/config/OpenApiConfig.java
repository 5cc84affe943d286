package com.example.aris.config;

import com.example.aris.controller.FeedController;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  public OpenAPI feedOpenAPI() {
    return new OpenAPI()
        .info(new Info()
            .title("ARIS Feed API")
            .version("v1")
            .description("Per-user feed, location updates and source actions. Every /v1 call is scoped "
                + "to the user named in the " + FeedController.USER_HEADER + " header."))
        .components(new Components()
            .addParameters("userId", new HeaderParameter()
                .name(FeedController.USER_HEADER)
                .required(true)
                .description("Selects the per-user feed engine; one is created on first use.")
                .schema(new StringSchema())));
  }

  @Bean
  public GroupedOpenApi feedApi() {
    return GroupedOpenApi.builder()
        .group("feed")
        .packagesToScan("com.example.aris.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
