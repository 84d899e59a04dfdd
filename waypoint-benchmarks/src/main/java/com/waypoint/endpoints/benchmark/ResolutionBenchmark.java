/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.benchmark;

import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.loader.RuleModelLoader;
import com.waypoint.endpoints.runtime.evaluation.EndpointResolver;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.RuleModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Endpoint resolution benchmark.
 *
 * <p>Models are generated per trial: a FIPS switch followed by a chain of
 * {@code stringEquals(Region, "region-i")} conditions, one endpoint result per
 * region. The parameter pool mixes matching regions, FIPS requests and
 * unknown regions (no-match).
 *
 * <p>USAGE:
 * <pre>
 * mvn clean package -pl waypoint-benchmarks -am -DskipTests
 * java -cp "waypoint-benchmarks/target/classes:..." com.waypoint.endpoints.benchmark.ResolutionBenchmark
 * </pre>
 *
 * <p>CONFIGURATION:
 * <ul>
 *   <li>{@code -Dbench.quick=true} - fewer, shorter iterations</li>
 * </ul>
 */
@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class ResolutionBenchmark {

    // ========================================================================
    // CONFIGURATION
    // ========================================================================

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final int WARMUP_ITERATIONS = QUICK_MODE ? 2 : 5;
    private static final int MEASUREMENT_ITERATIONS = QUICK_MODE ? 3 : 10;
    private static final int MEASUREMENT_TIME = QUICK_MODE ? 1 : 3;

    private static final int POOL_SIZE = 10_000;

    // ========================================================================
    // TEST PARAMETERS
    // ========================================================================

    @Param({"16", "128", "1024"})
    private int regionCount;

    // ========================================================================
    // STATE VARIABLES
    // ========================================================================

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    private EndpointResolver resolver;
    private List<EndpointParameters> parameterPool;
    private final AtomicInteger index = new AtomicInteger();

    private long loadNanos;

    // ========================================================================
    // SETUP METHODS
    // ========================================================================

    @Setup(Level.Trial)
    public void setupTrial() throws Exception {
        String json = generateModel(regionCount);

        long start = System.nanoTime();
        RuleModel model = new RuleModelLoader(FunctionRegistry.standard(), NOOP_TRACER)
                .load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        loadNanos = System.nanoTime() - start;

        resolver = new EndpointResolver(model, FunctionRegistry.standard(), ResolverConfig.defaults(), NOOP_TRACER);
        parameterPool = generateParameters(regionCount, POOL_SIZE);

        System.out.printf("%nModel: %d nodes, %d conditions, %d results, loaded in %.2f ms%n",
                model.getNodeCount(), model.getConditionCount(), model.getResultCount(), loadNanos / 1_000_000.0);
    }

    @Setup(Level.Iteration)
    public void setupIteration() {
        index.set(0);
    }

    @TearDown(Level.Trial)
    public void teardownTrial() {
        System.out.println("Resolver metrics: " + resolver.getDetailedMetrics());
    }

    // ========================================================================
    // BENCHMARK METHODS
    // ========================================================================

    /**
     * Throughput for batches of 100 resolutions.
     */
    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.SECONDS)
    public void throughput_batch100(Blackhole bh) {
        for (int i = 0; i < 100; i++) {
            bh.consume(resolver.resolve(next()));
        }
    }

    /**
     * Latency of a single resolution.
     */
    @Benchmark
    @BenchmarkMode(Mode.SampleTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public ResolutionResult latency_single() {
        return resolver.resolve(next());
    }

    /**
     * Latency with the diagnostic trace attached to every result.
     */
    @Benchmark
    @BenchmarkMode(Mode.SampleTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public ResolutionResult latency_withTrace() {
        return resolver.resolveWithTrace(next());
    }

    /**
     * Shared resolver under concurrent callers.
     */
    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @Threads(4)
    public void throughput_concurrent(Blackhole bh) {
        bh.consume(resolver.resolve(next()));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private EndpointParameters next() {
        return parameterPool.get((index.getAndIncrement() & Integer.MAX_VALUE) % parameterPool.size());
    }

    /**
     * Node 0 tests FIPS; node k (1..n) tests region k-1 and falls through to
     * node k+1, the last one to no-match.
     */
    static String generateModel(int regions) {
        StringBuilder json = new StringBuilder(256 + regions * 160);
        json.append("{\"version\":\"bench-").append(regions).append("\",");
        json.append("\"parameters\":{\"Region\":{\"type\":\"String\",\"required\":true},");
        json.append("\"UseFIPS\":{\"type\":\"Boolean\",\"required\":true,\"default\":false}},");

        json.append("\"conditions\":[{\"fn\":\"booleanEquals\",\"argv\":[{\"ref\":\"UseFIPS\"},true]}");
        for (int i = 0; i < regions; i++) {
            json.append(",{\"fn\":\"stringEquals\",\"argv\":[{\"ref\":\"Region\"},\"region-").append(i).append("\"]}");
        }
        json.append("],");

        json.append("\"results\":[");
        for (int i = 0; i < regions; i++) {
            json.append("{\"type\":\"endpoint\",\"endpoint\":{\"url\":\"https://svc.{Region}.example.com\",")
                    .append("\"headers\":{\"x-shard\":[\"").append(i % 8).append("\"]}}},");
        }
        json.append("{\"type\":\"endpoint\",\"endpoint\":{\"url\":\"https://svc-fips.{Region}.example.com\"}}],");

        json.append("\"nodes\":[[0,").append(-(regions + 2)).append(",1]");
        for (int k = 1; k <= regions; k++) {
            int low = k == regions ? -1 : k + 1;
            json.append(",[").append(k).append(',').append(-(k + 1)).append(',').append(low).append(']');
        }
        json.append("],\"root\":0}");
        return json.toString();
    }

    static List<EndpointParameters> generateParameters(int regions, int count) {
        Random rand = new Random(42);
        List<EndpointParameters> pool = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int roll = rand.nextInt(100);
            String region = roll < 5 ? "unknown-" + i : "region-" + rand.nextInt(regions);
            pool.add(EndpointParameters.builder()
                    .set("Region", region)
                    .set("UseFIPS", roll >= 5 && roll < 15)
                    .build());
        }
        return pool;
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ResolutionBenchmark.class.getSimpleName())
                .warmupIterations(WARMUP_ITERATIONS)
                .measurementIterations(MEASUREMENT_ITERATIONS)
                .measurementTime(TimeValue.seconds(MEASUREMENT_TIME))
                .shouldFailOnError(true)
                .build();

        new Runner(opt).run();
    }
}
