package com.ryuqq.autocycle.adapter.runner.health;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 플랫폼 MXBean과 파일 시스템 기반 자원 측정.
 *
 * <ul>
 *   <li>CPU: 시스템 CPU 부하 (지원하지 않으면 load average / 코어 수)</li>
 *   <li>메모리: 물리 메모리 사용률</li>
 *   <li>디스크: 데이터 디렉토리가 속한 파일 스토어 사용률</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class JvmResourceSampler implements ResourceSampler {

    private final OperatingSystemMXBean os;
    private final Path dataDirectory;

    public JvmResourceSampler(Path dataDirectory) {
        this(ManagementFactory.getOperatingSystemMXBean(), dataDirectory);
    }

    JvmResourceSampler(OperatingSystemMXBean os, Path dataDirectory) {
        if (os == null) {
            throw new IllegalArgumentException("os cannot be null");
        }
        if (dataDirectory == null) {
            throw new IllegalArgumentException("dataDirectory cannot be null");
        }
        this.os = os;
        this.dataDirectory = dataDirectory.toAbsolutePath();
    }

    @Override
    public double cpuLoadPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getCpuLoad();
            if (load >= 0.0) {
                return load * 100.0;
            }
        }
        double average = os.getSystemLoadAverage();
        if (average < 0.0) {
            throw new IllegalStateException("CPU load is not available on this platform");
        }
        return average / os.getAvailableProcessors() * 100.0;
    }

    @Override
    public double memoryPercent() {
        if (!(os instanceof com.sun.management.OperatingSystemMXBean)) {
            throw new IllegalStateException("physical memory size is not available on this platform");
        }
        com.sun.management.OperatingSystemMXBean extended = (com.sun.management.OperatingSystemMXBean) os;
        long total = extended.getTotalMemorySize();
        if (total <= 0) {
            throw new IllegalStateException("total memory size reported as " + total);
        }
        long used = total - extended.getFreeMemorySize();
        return used * 100.0 / total;
    }

    @Override
    public double diskPercent() throws IOException {
        FileStore store = Files.getFileStore(nearestExisting(dataDirectory));
        long total = store.getTotalSpace();
        if (total <= 0) {
            throw new IOException("file store " + store.name() + " reports no capacity");
        }
        long used = total - store.getUsableSpace();
        return used * 100.0 / total;
    }

    private static Path nearestExisting(Path path) {
        Path current = path;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current != null ? current : path.getRoot();
    }
}
