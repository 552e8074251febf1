package com.irondust.catalog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.irondust.catalog.model.DescriptionRules;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties(DescriptionProperties.class)
public class DescriptionConfig {

    @Bean
    public DescriptionRules descriptionRules(ObjectMapper objectMapper,
                                             ResourceLoader resourceLoader,
                                             DescriptionProperties properties) {
        DescriptionRules rules = new DescriptionRulesLoader(objectMapper, resourceLoader)
                .load(properties.getRulesLocation());
        String iconsPath = properties.getIconsPath();
        if (iconsPath != null && !iconsPath.isBlank()) {
            rules = rules.toBuilder().iconsPath(iconsPath).build();
        }
        return rules;
    }
}
