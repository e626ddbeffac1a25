package com.ryuqq.autocycle.application.pipeline;

import com.ryuqq.autocycle.core.cycle.TargetOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 대상별 독립 실행 (PUBLISH, PROMOTION).
 *
 * <p>대상마다 작업 하나를 워커 풀에 제출하고, 제출한 스레드에서 등록 순서대로 결과를 모읍니다.
 * 작업은 공유 상태를 변경하지 않습니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>예외 → 해당 대상 실패</li>
 *   <li>{@code targetTimeoutMs} 초과 → Future 취소 후 실패</li>
 *   <li>인터럽트 → 남은 작업 취소 후 실패, 인터럽트 플래그 복원</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class TargetFanOut {

    private static final Logger log = LoggerFactory.getLogger(TargetFanOut.class);

    private final ExecutorService workers;
    private final long targetTimeoutMs;

    public TargetFanOut(ExecutorService workers, long targetTimeoutMs) {
        if (workers == null) {
            throw new IllegalArgumentException("workers cannot be null");
        }
        if (targetTimeoutMs <= 0) {
            throw new IllegalArgumentException("targetTimeoutMs must be positive (current: " + targetTimeoutMs + ")");
        }
        this.workers = workers;
        this.targetTimeoutMs = targetTimeoutMs;
    }

    /**
     * 모든 대상 실행 후 결과 수집.
     *
     * @param handles 대상 이름 → 협력자 (등록 순서)
     * @param call 대상 호출
     * @param <T> 협력자 타입
     * @return 대상 결과 (등록 순서)
     */
    public <T> List<TargetOutcome> run(Map<String, T> handles, TargetCall<T> call) {
        List<String> names = new ArrayList<>(handles.keySet());
        List<Future<List<TargetOutcome>>> futures = new ArrayList<>();
        for (Map.Entry<String, T> entry : handles.entrySet()) {
            futures.add(submit(entry.getKey(), entry.getValue(), call));
        }

        List<TargetOutcome> outcomes = new ArrayList<>();
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            String target = names.get(i);
            Future<List<TargetOutcome>> future = futures.get(i);
            if (future == null) {
                outcomes.add(TargetOutcome.failed(target, "worker pool rejected task"));
                continue;
            }
            if (interrupted) {
                future.cancel(true);
                outcomes.add(TargetOutcome.failed(target, "interrupted"));
                continue;
            }
            try {
                outcomes.addAll(normalize(target, future.get(targetTimeoutMs, TimeUnit.MILLISECONDS)));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Target {} timed out after {} ms", target, targetTimeoutMs);
                outcomes.add(TargetOutcome.failed(target, "timed out after " + targetTimeoutMs + " ms"));
            } catch (ExecutionException e) {
                String message = Failures.describe(e.getCause());
                log.warn("Target {} failed: {}", target, message);
                outcomes.add(TargetOutcome.failed(target, message));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                outcomes.add(TargetOutcome.failed(target, "interrupted"));
            }
        }
        return outcomes;
    }

    private <T> Future<List<TargetOutcome>> submit(String target, T handle, TargetCall<T> call) {
        try {
            return workers.submit(() -> call.call(target, handle));
        } catch (RejectedExecutionException e) {
            log.warn("Target {} rejected by worker pool", target);
            return null;
        }
    }

    private static List<TargetOutcome> normalize(String target, List<TargetOutcome> result) {
        if (result == null) {
            return List.of(TargetOutcome.failed(target, "target returned null"));
        }
        return result;
    }
}
