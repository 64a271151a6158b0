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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the registry name of a {@link HarmonicityMetric} implementation.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * @MetricName("tenney")
 * public final class TenneyHeight implements HarmonicityMetric {
 *     ...
 * }
 * }</pre>
 *
 * <p>Names are lowercase with underscores for multi-word names
 * (e.g. "barlow", "simplified_barlow") and must be unique within one
 * {@link HarmonicityMetrics} registry.
 *
 * @see HarmonicityMetrics
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface MetricName {
    /**
     * The name under which the metric is registered.
     *
     * @return the metric name
     */
    String value();
}
