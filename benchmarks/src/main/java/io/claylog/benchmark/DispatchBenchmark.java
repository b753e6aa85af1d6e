package io.claylog.benchmark;

import io.claylog.Environment;
import io.claylog.LogConfig;
import io.claylog.LogDispatcher;
import io.claylog.LogRuntime;
import io.claylog.heap.HeapStatistics;
import org.openjdk.jmh.annotations.*;

import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures LogDispatcher.log() throughput (ops/sec) with the JSON engine writing
 * to a discarding sink.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DispatchBenchmark}
 * <p>Heap enrichment only: {@code java -jar benchmarks/target/benchmarks.jar -p heap=true -p pretty=false DispatchBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DispatchBenchmark {

  private static final Map<String, Object> DATA = Map.of(
      "orderId", "A-17",
      "items", 3,
      "total", 129.95);

  @Param({"false", "true"})
  private boolean heap;

  @Param({"false", "true"})
  private boolean pretty;

  private LogDispatcher log;

  @Setup(Level.Trial)
  public void setup() {
    LogRuntime runtime = LogRuntime.builder()
        .environment(Environment.of(Map.of(Environment.HEAP, heap ? "1" : "0")))
        .heapStatistics(HeapStatistics.detect())
        .build();
    log = runtime.init(LogConfig.builder()
        .name("bench")
        .pretty(pretty)
        .output(OutputStream.nullOutputStream())
        .meta(Map.of("region", "eu-west-1"))
        .build());
  }

  @Benchmark
  public void messageOnly() {
    log.log("info", "order placed");
  }

  @Benchmark
  public void messageWithData() {
    log.log("info", "order placed", DATA);
  }

  @Benchmark
  public void failure() {
    log.log(new IllegalStateException("payment declined"), DATA);
  }

  @Benchmark
  public void malformedCall() {
    log.log("verbose", "unknown level");
  }

  @Benchmark
  public void belowThreshold() {
    log.log("debug", "dropped before encoding", DATA);
  }
}
