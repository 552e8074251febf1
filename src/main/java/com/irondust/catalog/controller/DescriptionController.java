package com.irondust.catalog.controller;

import com.irondust.catalog.dto.DescriptionDtos;
import com.irondust.catalog.model.DescriptionResult;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupingResult;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.DescriptionBatchService;
import com.irondust.catalog.service.description.DescriptionAssembler;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/descriptions")
public class DescriptionController {
    private final DescriptionAssembler assembler;
    private final DescriptionBatchService batchService;
    private final DescriptionRules rules;

    public DescriptionController(DescriptionAssembler assembler, DescriptionBatchService batchService, DescriptionRules rules) {
        this.assembler = assembler;
        this.batchService = batchService;
        this.rules = rules;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DescriptionResult>> build(@Valid @RequestBody ProductRecord product) {
        return Mono.fromCallable(() -> assembler.build(product))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DescriptionDtos.BatchReport>> batch(@RequestBody List<ProductRecord> products) {
        return batchService.process(products).map(ResponseEntity::ok);
    }

    /** Grouped characteristics only, for checking classification rules against real data. */
    @PostMapping(value = "/characteristics", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, List<Map<String, Object>>>> characteristics(@RequestBody(required = false) String raw) {
        return Mono.fromSupplier(() -> toView(assembler.group(raw)));
    }

    @GetMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DescriptionDtos.RulesSummary> rules() {
        DescriptionDtos.RulesSummary s = new DescriptionDtos.RulesSummary();
        s.setGroupOrder(rules.groupDisplayOrder());
        s.setDefaultGroup(rules.getDefaultGroup());
        s.setVocabulary(rules.getVocabulary());
        s.setDimensionsSlug(rules.getDimensionsSlug());
        s.setExtractFields(new ArrayList<>(rules.getExtractFields().keySet()));
        return Mono.just(s);
    }

    private Map<String, List<Map<String, Object>>> toView(GroupingResult grouped) {
        Map<String, List<Map<String, Object>>> out = new LinkedHashMap<>();
        for (String group : rules.groupDisplayOrder()) {
            List<Map<String, Object>> items = new ArrayList<>();
            grouped.get(group).forEach(c -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("key", c.getKey());
                m.put("value", c.getValue());
                if (c.isExternalAttribute()) m.put("attribute", c.getAttributeSlug());
                items.add(m);
            });
            if (!items.isEmpty()) out.put(group, items);
        }
        return out;
    }
}
