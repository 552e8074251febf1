package com.irondust.catalog.controller;

import com.irondust.catalog.model.DescriptionRules;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {
    private final DescriptionRules rules;

    public HealthController(DescriptionRules rules) { this.rules = rules; }

    // Minimal rules still serve requests, so health stays ok; rulesLoaded tells them apart
    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        boolean rulesLoaded = !rules.getGroupRules().isEmpty() || !rules.getVocabulary().isEmpty();
        return Mono.just(ResponseEntity.ok(Map.<String, Object>of(
                "ok", Boolean.TRUE,
                "rulesLoaded", rulesLoaded)));
    }
}
