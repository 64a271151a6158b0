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

import io.tonalis.ji.JustIntonationPitch;
import io.tonalis.ji.ratio.RatioFactors;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH benchmark for harmonicity evaluation and pitch arithmetic.
 *
 * <h2>Benchmark Configurations</h2>
 *
 * <ul>
 *   <li>Ratios from a small 5-limit interval up to a 23-limit one</li>
 *   <li>All standard metrics evaluated through the registry</li>
 *   <li>Throughput measured in ops/millisecond</li>
 * </ul>
 *
 * <h2>Running</h2>
 *
 * <pre>{@code
 * mvn test -pl tonalis-ji -Pperformance -Dtest=HarmonicityJmhBenchmark
 * }</pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@Tag("performance")
public class HarmonicityJmhBenchmark {

    @Param({"5/4", "135/128", "1001/960", "391/384"})
    private String ratio;

    private JustIntonationPitch pitch;
    private JustIntonationPitch other;
    private RatioFactors factors;
    private HarmonicityMetrics metrics;

    @Setup(Level.Trial)
    public void setup() {
        pitch = new JustIntonationPitch(ratio);
        other = new JustIntonationPitch("7/6");
        factors = pitch.getFactors();
        metrics = HarmonicityMetrics.standard();
    }

    @Benchmark
    public void evaluateAllMetrics(Blackhole bh) {
        bh.consume(metrics.evaluateAll(factors));
    }

    @Benchmark
    public void factorizeAndEvaluateBarlow(Blackhole bh) {
        bh.consume(pitch.getHarmonicityBarlow());
    }

    @Benchmark
    public void addAndNormalize(Blackhole bh) {
        bh.consume(pitch.add(other).normalize());
    }

    @Benchmark
    public void closestPythagoreanPitchName(Blackhole bh) {
        bh.consume(pitch.getClosestPythagoreanPitchName());
    }

    /**
     * Runs the JMH benchmark from JUnit.
     * Enable with: mvn test -pl tonalis-ji -Pperformance
     */
    @Test
    @Tag("performance")
    public void runBenchmark() throws RunnerException {
        Options opt = new OptionsBuilder()
            .include(HarmonicityJmhBenchmark.class.getSimpleName())
            .warmupIterations(2)
            .measurementIterations(3)
            .forks(1)
            .resultFormat(ResultFormatType.TEXT)
            .build();

        new Runner(opt).run();
    }
}
