package com.scholary.djset.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** API metadata for the generated OpenAPI document and Swagger UI. */
@Configuration
public class OpenApiConfig {

  @Bean
  public OpenAPI djSetSplitterOpenApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("DJ Set Splitter API")
                .version("v1")
                .description(
                    "Downloads DJ sets, splits them into tracks with ffmpeg and reports progress"
                        + " by polling or server-sent events."));
  }
}
