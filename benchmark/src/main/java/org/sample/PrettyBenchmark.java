package org.sample;

import io.github.simbo1905.simple_pretty.PrettyOptions;
import io.github.simbo1905.simple_pretty.PrettyPrinter;
import io.github.simbo1905.simple_pretty.PrettyText;
import org.openjdk.jmh.annotations.*;

import java.util.*;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class PrettyBenchmark {

    private Map<String, Object> testData;

    private PrettyPrinter narrow;
    private PrettyPrinter wide;
    private PrettyPrinter unconstrained;

    @Setup
    public void setup() {
        testData = new LinkedHashMap<>();
        for (int i = 0; i < 20; i++) {
            final Map<String, Object> person = new LinkedHashMap<>();
            person.put("name", "person-" + i);
            person.put("age", 20 + i);
            person.put("tags", new ArrayList<>(List.of("alpha", "beta", "gamma")));
            person.put("scores", List.of(i, i * 2, i * 3));
            person.put("address", Map.of("city", "London", "zip", "N1 " + i));
            testData.put("p" + i, person);
        }
        // make it cyclic so the guard is exercised
        testData.put("self", testData);

        narrow = PrettyPrinter.of(PrettyOptions.DEFAULTS.withMaxWidth(40));
        wide = PrettyPrinter.of(PrettyOptions.DEFAULTS.withMaxWidth(120));
        unconstrained = PrettyPrinter.of(PrettyOptions.DEFAULTS.unconstrained());
    }

    @Benchmark
    public PrettyText prettyNarrow() {
        return narrow.render(testData);
    }

    @Benchmark
    public PrettyText prettyWide() {
        return wide.render(testData);
    }

    @Benchmark
    public PrettyText prettyUnconstrained() {
        return unconstrained.render(testData);
    }

    @Benchmark
    public String jdkToString() {
        return testData.toString();
    }
}
