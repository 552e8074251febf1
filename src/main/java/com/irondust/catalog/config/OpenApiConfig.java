package com.irondust.catalog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    static final String DESCRIPTIONS_TAG = "descriptions";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Catalog Description API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API that parses product characteristics, maps them to "
                                + "store attributes and assembles HTML descriptions with excerpts."))
                .addTagsItem(new Tag().name(DESCRIPTIONS_TAG).description("Single and batch description builds"));
    }

    @Bean
    public OpenApiCustomizer descriptionsTagCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            openAPI.getPaths().forEach((path, item) -> {
                if (path.startsWith("/descriptions")) tagAllOperations(item);
            });
        };
    }

    private static void tagAllOperations(PathItem item) {
        item.readOperations().forEach(op -> {
            if (op.getTags() == null || !op.getTags().contains(DESCRIPTIONS_TAG)) op.addTagsItem(DESCRIPTIONS_TAG);
        });
    }
}
