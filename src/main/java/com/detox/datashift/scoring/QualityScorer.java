package com.detox.datashift.scoring;

import java.util.List;
import java.util.Map;

/**
 * Scores paired input/output texts of the rewriting model.
 *
 * Every returned sequence must be parallel to {@code inputs}: same length, same order.
 * Implementations raise {@link com.detox.datashift.exception.QualityScoringException}
 * on transport or contract failures.
 */
public interface QualityScorer {

    Map<String, List<Double>> score(List<String> inputs, List<String> outputs);
}
