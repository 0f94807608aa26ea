package com.detox.datashift.scoring;

import com.detox.datashift.exception.QualityScoringException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic scorer: STA is 1.0 when the output is shorter than the input,
 * SIM is the output/input length ratio.
 */
public class FakeQualityScorer implements QualityScorer {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean failing;

    @Override
    public Map<String, List<Double>> score(List<String> inputs, List<String> outputs) {
        calls.incrementAndGet();
        if (failing) {
            throw new QualityScoringException("evaluation service down");
        }
        List<Double> sta = new ArrayList<>();
        List<Double> sim = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            double in = inputs.get(i).length();
            double out = outputs.get(i).length();
            sta.add(out < in ? 1.0 : 0.0);
            sim.add(out / in);
        }
        Map<String, List<Double>> scores = new LinkedHashMap<>();
        scores.put("STA", sta);
        scores.put("SIM", sim);
        return scores;
    }

    public FakeQualityScorer failing() {
        this.failing = true;
        return this;
    }

    public int calls() {
        return calls.get();
    }
}
