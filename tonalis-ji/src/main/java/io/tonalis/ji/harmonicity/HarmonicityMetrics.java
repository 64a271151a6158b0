package io.tonalis.ji.harmonicity;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tonalis.ji.ratio.RatioFactors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name-indexed registry of {@link HarmonicityMetric} implementations.
 *
 * <p>Metric names come from the {@link MetricName} annotation on each class, or
 * fall back to {@link HarmonicityMetric#getMetricName()}. Registration order is
 * kept, so {@link #evaluateAll(RatioFactors)} returns scores in a stable order.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * HarmonicityMetrics metrics = HarmonicityMetrics.standard();
 * double tenney = metrics.get("tenney").evaluate(pitch.getFactors());
 * Map<String, Double> all = metrics.evaluateAll(pitch.getFactors());
 * }</pre>
 */
public final class HarmonicityMetrics {

    private static final HarmonicityMetrics STANDARD = create();

    private final Map<String, HarmonicityMetric> metrics = new LinkedHashMap<>();

    private HarmonicityMetrics() {
    }

    /**
     * Creates a new registry with all standard metrics registered.
     *
     * @return a configured registry
     */
    public static HarmonicityMetrics create() {
        HarmonicityMetrics registry = new HarmonicityMetrics();

        registry.register(new BarlowHarmonicity());
        registry.register(new SimplifiedBarlowHarmonicity());
        registry.register(new EulerGradusSuavitatis());
        registry.register(new TenneyHeight());
        registry.register(new VogelComplexity());
        registry.register(new WilsonComplexity());

        return registry;
    }

    /**
     * Returns a shared registry holding the standard metrics. It must not be
     * extended; call {@link #create()} for a private registry instead.
     *
     * @return the shared standard registry
     */
    public static HarmonicityMetrics standard() {
        return STANDARD;
    }

    /**
     * Registers a metric under its annotated name.
     *
     * @param metric the metric to register
     * @throws IllegalArgumentException if the name is already registered
     */
    public void register(HarmonicityMetric metric) {
        if (this == STANDARD) {
            throw new UnsupportedOperationException("The standard metric registry is read-only");
        }
        MetricName annotation = metric.getClass().getAnnotation(MetricName.class);
        String name = annotation != null ? annotation.value() : metric.getMetricName();

        if (metrics.containsKey(name)) {
            throw new IllegalArgumentException(
                "Metric '" + name + "' is already registered to " +
                metrics.get(name).getClass().getName());
        }
        metrics.put(name, metric);
    }

    /**
     * Looks up a metric by name.
     *
     * @param name the metric name
     * @return the metric
     * @throws IllegalArgumentException if no metric has this name
     */
    public HarmonicityMetric get(String name) {
        HarmonicityMetric metric = metrics.get(name);
        if (metric == null) {
            throw new IllegalArgumentException(
                "Unknown harmonicity metric '" + name + "', known: " + metrics.keySet());
        }
        return metric;
    }

    /// @return registered names in registration order
    public Set<String> names() {
        return Collections.unmodifiableSet(metrics.keySet());
    }

    /**
     * Scores one ratio with every registered metric.
     *
     * @param factors the split prime factorization
     * @return metric name to score, in registration order
     */
    public Map<String, Double> evaluateAll(RatioFactors factors) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, HarmonicityMetric> entry : metrics.entrySet()) {
            scores.put(entry.getKey(), entry.getValue().evaluate(factors));
        }
        return scores;
    }
}
