package com.irondust.catalog.service;

import com.irondust.catalog.config.DescriptionProperties;
import com.irondust.catalog.dto.DescriptionDtos;
import com.irondust.catalog.model.DescriptionResult;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.model.Warn;
import com.irondust.catalog.service.description.DescriptionAssembler;
import com.irondust.catalog.service.description.DescriptionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds descriptions for a list of products.
 *
 * <p>Products are independent, so they run in parallel with bounded concurrency.
 * A product that fails is recorded in the report and the batch keeps going.
 */
@Service
public class DescriptionBatchService {
    private static final Logger log = LoggerFactory.getLogger(DescriptionBatchService.class);

    private final DescriptionAssembler assembler;
    private final int parallelism;

    @Autowired
    public DescriptionBatchService(DescriptionAssembler assembler, DescriptionProperties properties) {
        this(assembler, properties.getBatchParallelism());
    }

    public DescriptionBatchService(DescriptionAssembler assembler, int parallelism) {
        this.assembler = assembler;
        this.parallelism = Math.max(1, parallelism);
    }

    public Mono<DescriptionDtos.BatchReport> process(List<ProductRecord> products) {
        List<ProductRecord> input = products != null ? products : List.of();
        DescriptionStats stats = new DescriptionStats();
        AtomicInteger counter = new AtomicInteger(0);
        log.info("Starting description batch: {} products, parallelism {}", input.size(), parallelism);

        return Flux.range(0, input.size())
                .flatMapSequential(i -> Mono.fromCallable(() -> buildOne(input.get(i), stats))
                        .onErrorResume(e -> Mono.just(failed(input.get(i), e, stats)))
                        .doOnNext(r -> {
                            int done = counter.incrementAndGet();
                            if (done % 50 == 0) log.info("Built {}/{} descriptions", done, input.size());
                        })
                        .subscribeOn(Schedulers.boundedElastic()),
                        parallelism)
                .collectList()
                .map(reports -> toReport(reports, stats));
    }

    private DescriptionDtos.ProductReport buildOne(ProductRecord product, DescriptionStats stats) {
        if (product == null) {
            throw new IllegalArgumentException("product is null");
        }
        DescriptionResult result = assembler.build(product, stats);
        return new DescriptionDtos.ProductReport(product.getSku(), result, null);
    }

    private DescriptionDtos.ProductReport failed(ProductRecord product, Throwable e, DescriptionStats stats) {
        String id = product != null ? product.logId() : "n/a";
        log.error("Description batch item {} failed: {}", id, e.toString());
        stats.recordError(Warn.buildFailed(id, e.toString()));
        return new DescriptionDtos.ProductReport(product != null ? product.getSku() : "", null, e.toString());
    }

    private DescriptionDtos.BatchReport toReport(List<DescriptionDtos.ProductReport> reports, DescriptionStats stats) {
        int failed = (int) reports.stream().filter(r -> r.getResult() == null).count();
        DescriptionDtos.BatchReport report = new DescriptionDtos.BatchReport();
        report.setProducts(new ArrayList<>(reports));
        report.setProcessed(reports.size() - failed);
        report.setFailed(failed);
        report.setErrors(stats.getErrors());
        report.setStats(stats.snapshot());
        log.info("Description batch completed: {} built, {} failed, {} warnings",
                report.getProcessed(), failed, report.getErrors().size());
        return report;
    }
}
