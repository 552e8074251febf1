package com.irondust.catalog.service.description;

import com.irondust.catalog.model.Warn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run statistics supplied by the caller of a build or a batch.
 *
 * <p>Counters are atomic and the error list is a concurrent queue, so one
 * instance may be shared by workers processing products in parallel.
 */
public class DescriptionStats {
    private final AtomicLong characteristicsParsed = new AtomicLong();
    private final AtomicLong characteristicsGrouped = new AtomicLong();
    private final AtomicLong attributesMatched = new AtomicLong();
    private final AtomicLong descriptionsBuilt = new AtomicLong();
    private final AtomicLong totalLength = new AtomicLong();
    private final ConcurrentLinkedQueue<Warn> errors = new ConcurrentLinkedQueue<>();

    public void addParsed(long n) { characteristicsParsed.addAndGet(n); }
    public void addGrouped(long n) { characteristicsGrouped.addAndGet(n); }
    public void addAttributesMatched(long n) { attributesMatched.addAndGet(n); }

    public void recordDescription(int length) {
        descriptionsBuilt.incrementAndGet();
        totalLength.addAndGet(length);
    }

    public void recordError(Warn warn) {
        if (warn != null) errors.add(warn);
    }

    public long getCharacteristicsParsed() { return characteristicsParsed.get(); }
    public long getCharacteristicsGrouped() { return characteristicsGrouped.get(); }
    public long getAttributesMatched() { return attributesMatched.get(); }
    public long getDescriptionsBuilt() { return descriptionsBuilt.get(); }
    public long getTotalLength() { return totalLength.get(); }
    public List<Warn> getErrors() { return new ArrayList<>(errors); }

    public double getAverageLength() {
        long built = descriptionsBuilt.get();
        if (built == 0) return 0.0;
        return Math.round(totalLength.get() * 10.0 / built) / 10.0;
    }

    /** Point-in-time view for reports. */
    public Map<String, Object> snapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("characteristics_parsed", getCharacteristicsParsed());
        m.put("characteristics_grouped", getCharacteristicsGrouped());
        m.put("attributes_matched", getAttributesMatched());
        m.put("descriptions_built", getDescriptionsBuilt());
        m.put("total_length", getTotalLength());
        m.put("average_length", getAverageLength());
        m.put("errors", errors.size());
        return m;
    }
}
