package com.ryuqq.autocycle.adapter.runner.health;

/**
 * 헬스 상태 판정 임계값 (불변 record).
 *
 * <p><strong>판정 규칙:</strong></p>
 * <pre>
 * errorCount &gt; criticalErrorCount            → CRITICAL
 * cpu &gt; cpu% 또는 memory &gt; mem% 또는 disk &gt; disk% → WARNING
 * 그 외                                       → HEALTHY
 * </pre>
 *
 * @param cpuWarningPercent CPU 경고 임계값 (기본 80)
 * @param memoryWarningPercent 메모리 경고 임계값 (기본 80)
 * @param diskWarningPercent 디스크 경고 임계값 (기본 90)
 * @param criticalErrorCount 누적 오류 임계값 (기본 10)
 * @author Autocycle Team
 * @since 1.0.0
 */
public record HealthThresholds(
    double cpuWarningPercent,
    double memoryWarningPercent,
    double diskWarningPercent,
    long criticalErrorCount
) {

    public HealthThresholds() {
        this(80.0, 80.0, 90.0, 10);
    }

    public HealthThresholds {
        requirePercent("cpuWarningPercent", cpuWarningPercent);
        requirePercent("memoryWarningPercent", memoryWarningPercent);
        requirePercent("diskWarningPercent", diskWarningPercent);
        if (criticalErrorCount < 0) {
            throw new IllegalArgumentException(
                "criticalErrorCount must not be negative (current: " + criticalErrorCount + ")"
            );
        }
    }

    public HealthThresholds withCpuWarningPercent(double cpuWarningPercent) {
        return new HealthThresholds(cpuWarningPercent, memoryWarningPercent, diskWarningPercent, criticalErrorCount);
    }

    public HealthThresholds withMemoryWarningPercent(double memoryWarningPercent) {
        return new HealthThresholds(cpuWarningPercent, memoryWarningPercent, diskWarningPercent, criticalErrorCount);
    }

    public HealthThresholds withDiskWarningPercent(double diskWarningPercent) {
        return new HealthThresholds(cpuWarningPercent, memoryWarningPercent, diskWarningPercent, criticalErrorCount);
    }

    public HealthThresholds withCriticalErrorCount(long criticalErrorCount) {
        return new HealthThresholds(cpuWarningPercent, memoryWarningPercent, diskWarningPercent, criticalErrorCount);
    }

    private static void requirePercent(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 (current: " + value + ")");
        }
    }
}
