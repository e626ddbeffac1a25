package com.ryuqq.autocycle.daemon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.autocycle.adapter.runner.DaemonSupervisor;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.spi.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 데몬 진입점.
 *
 * <pre>
 * autocycle [run]     중지 요청(SIGTERM, Ctrl+C)까지 주기 실행
 * autocycle run-once  단일 시도 슬롯 실행, 성공 0 / 실패 1
 * autocycle status    저장된 상태 출력, 없으면 1
 * autocycle health    새 헬스 스냅샷 출력
 * </pre>
 *
 * <p>알 수 없는 명령은 2, 치명적 오류는 3으로 종료합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class AutocycleMain {

    private static final Logger log = LoggerFactory.getLogger(AutocycleMain.class);

    private final PrintStream out;
    private final PrintStream err;
    private final Supplier<DaemonProperties> propertiesLoader;
    private final Function<DaemonProperties, DaemonAssembly> assemblyFactory;

    AutocycleMain(PrintStream out, PrintStream err, Supplier<DaemonProperties> propertiesLoader,
                  Function<DaemonProperties, DaemonAssembly> assemblyFactory) {
        this.out = out;
        this.err = err;
        this.propertiesLoader = propertiesLoader;
        this.assemblyFactory = assemblyFactory;
    }

    public static void main(String[] args) {
        AutocycleMain main = new AutocycleMain(System.out, System.err, DaemonProperties::load, DaemonAssembly::new);
        System.exit(main.run(args).code());
    }

    /**
     * 명령 실행 후 종료 코드 반환 (JVM은 종료하지 않음).
     *
     * @param args 명령행 인자
     * @return 종료 코드
     */
    ExitCode run(String[] args) {
        Optional<CliCommand> parsed = CliCommand.parse(args);
        if (parsed.isEmpty()) {
            log.error("Unknown command: {}", args[0]);
            err.println(CliCommand.USAGE);
            return ExitCode.INVALID_ARGS;
        }
        CliCommand command = parsed.get();

        try {
            DaemonProperties properties = propertiesLoader.get();
            try (DaemonAssembly assembly = assemblyFactory.apply(properties)) {
                return switch (command) {
                    case RUN -> runForever(assembly);
                    case RUN_ONCE -> runOnce(assembly);
                    case STATUS -> status(assembly);
                    case HEALTH -> health(assembly);
                };
            }
        } catch (PersistenceException e) {
            log.error("Fatal persistence failure during '{}': {}", command.token(), e.getMessage(), e);
            return ExitCode.FATAL;
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("Fatal error during '{}'", command.token(), e);
            return ExitCode.FATAL;
        }
    }

    private ExitCode runForever(DaemonAssembly assembly) {
        DaemonSupervisor supervisor = assembly.supervisor(assembly.properties().supervisor());
        long shutdownWaitMs = assembly.properties().shutdownWaitMs();
        Thread hook = new Thread(() -> {
            supervisor.requestStop();
            try {
                if (!supervisor.awaitStopped(shutdownWaitMs)) {
                    log.warn("Supervisor did not stop within {} ms", shutdownWaitMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "autocycle-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        log.info("Starting autocycle daemon (data: {})", assembly.properties().dataDirectory().toAbsolutePath());
        supervisor.runForever();
        removeHook(hook);
        return ExitCode.SUCCESS;
    }

    private ExitCode runOnce(DaemonAssembly assembly) throws JsonProcessingException {
        DaemonSupervisor supervisor = assembly.supervisor(assembly.properties().supervisor().withMaxRetries(1));
        CycleReport report = supervisor.runOnce();
        out.println(assembly.mapper().writeValueAsString(report));
        return report.outcome().isSuccess() ? ExitCode.SUCCESS : ExitCode.FAILURE;
    }

    private ExitCode status(DaemonAssembly assembly) throws JsonProcessingException {
        Optional<HealthSnapshot> snapshot = assembly.statusStore().read();
        if (snapshot.isEmpty()) {
            err.println("No status file found at " + assembly.statusStore().statusFile().toAbsolutePath()
                + " (has the daemon run yet?)");
            return ExitCode.FAILURE;
        }
        out.println(assembly.mapper().writeValueAsString(snapshot.get()));
        return ExitCode.SUCCESS;
    }

    private ExitCode health(DaemonAssembly assembly) throws JsonProcessingException {
        assembly.statusStore().read().ifPresent(assembly.monitor()::restore);
        HealthSnapshot snapshot = assembly.monitor().sample();
        out.println(assembly.mapper().writeValueAsString(snapshot));
        return ExitCode.SUCCESS;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM shutdown already in progress
            log.debug("Shutdown in progress, hook left registered");
        }
    }
}
