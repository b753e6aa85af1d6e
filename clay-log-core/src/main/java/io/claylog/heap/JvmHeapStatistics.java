package io.claylog.heap;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link HeapStatistics} read from the platform MXBeans.
 *
 * <p>Counters:
 * <ul>
 *   <li>{@code total_heap_size}: committed heap bytes</li>
 *   <li>{@code used_heap_size}: used heap bytes</li>
 *   <li>{@code heap_size_limit}: maximum heap bytes, {@code -1} if undefined</li>
 *   <li>{@code total_available_size}: bytes left before the limit (or before the committed size without a limit)</li>
 *   <li>{@code peak_used_heap_size}: sum of peak usage over heap pools</li>
 *   <li>{@code total_non_heap_size} / {@code used_non_heap_size}: committed and used non-heap bytes</li>
 *   <li>{@code gc_count} / {@code gc_time_ms}: collections and accumulated collection time over all collectors</li>
 * </ul>
 */
public final class JvmHeapStatistics implements HeapStatistics {

  private final MemoryMXBean memory;
  private final List<MemoryPoolMXBean> pools;
  private final List<GarbageCollectorMXBean> collectors;

  private JvmHeapStatistics(MemoryMXBean memory, List<MemoryPoolMXBean> pools,
      List<GarbageCollectorMXBean> collectors) {
    this.memory = memory;
    this.pools = pools;
    this.collectors = collectors;
  }

  static JvmHeapStatistics create() {
    return new JvmHeapStatistics(
        ManagementFactory.getMemoryMXBean(),
        ManagementFactory.getMemoryPoolMXBeans(),
        ManagementFactory.getGarbageCollectorMXBeans());
  }

  @Override
  public Map<String, Number> snapshot() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();
    long limit = heap.getMax();
    long ceiling = limit < 0 ? heap.getCommitted() : limit;

    long peak = 0;
    for (MemoryPoolMXBean pool : pools) {
      if (pool.getType() == MemoryType.HEAP && pool.isValid()) {
        MemoryUsage usage = pool.getPeakUsage();
        if (usage != null) {
          peak += usage.getUsed();
        }
      }
    }
    long gcCount = 0;
    long gcTime = 0;
    for (GarbageCollectorMXBean collector : collectors) {
      // -1 means the collector does not report the value
      gcCount += Math.max(0, collector.getCollectionCount());
      gcTime += Math.max(0, collector.getCollectionTime());
    }

    Map<String, Number> stats = new LinkedHashMap<>();
    stats.put("total_heap_size", heap.getCommitted());
    stats.put("used_heap_size", heap.getUsed());
    stats.put("heap_size_limit", limit);
    stats.put("total_available_size", Math.max(0, ceiling - heap.getUsed()));
    stats.put("peak_used_heap_size", peak);
    stats.put("total_non_heap_size", nonHeap.getCommitted());
    stats.put("used_non_heap_size", nonHeap.getUsed());
    stats.put("gc_count", gcCount);
    stats.put("gc_time_ms", gcTime);
    return stats;
  }
}
