package com.inferencelab.backend.chat.service;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import org.springframework.stereotype.Component;

/**
 * Samples host CPU and memory usage for the metrics endpoint.
 *
 * <p>CPU load is measured between consecutive reads, so the probe takes one throwaway reading on
 * construction; every later {@link #sample()} covers the interval since the previous call.
 */
@Component
public class HostResourceProbe {

  private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

  private final OperatingSystemMXBean os;

  public HostResourceProbe() {
    this(ManagementFactory.getOperatingSystemMXBean());
  }

  HostResourceProbe(OperatingSystemMXBean os) {
    this.os = os;
    if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
      mx.getCpuLoad();
    }
  }

  public HostResources sample() {
    if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
      long total = mx.getTotalMemorySize();
      long free = mx.getFreeMemorySize();
      long used = total - free;
      return new HostResources(
          percent(mx.getCpuLoad()),
          total / BYTES_PER_GB,
          used / BYTES_PER_GB,
          total > 0 ? used * 100d / total : 0d);
    }

    Runtime runtime = Runtime.getRuntime();
    long total = runtime.maxMemory();
    long used = runtime.totalMemory() - runtime.freeMemory();
    double load = os.getSystemLoadAverage();
    double cpu = load >= 0 ? Math.min(100d, load * 100d / os.getAvailableProcessors()) : 0d;
    return new HostResources(
        cpu, total / BYTES_PER_GB, used / BYTES_PER_GB, total > 0 ? used * 100d / total : 0d);
  }

  private static double percent(double load) {
    // negative means the value is not available yet
    return load < 0 ? 0d : load * 100d;
  }

  public record HostResources(
      double cpuPercent, double memoryTotalGb, double memoryUsedGb, double memoryPercent) {}
}
