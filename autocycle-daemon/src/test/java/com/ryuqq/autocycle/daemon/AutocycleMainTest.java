package com.ryuqq.autocycle.daemon;

import com.ryuqq.autocycle.adapter.runner.SupervisorConfig;
import com.ryuqq.autocycle.adapter.runner.health.HealthThresholds;
import com.ryuqq.autocycle.application.pipeline.PipelineConfig;
import com.ryuqq.autocycle.core.capability.CapabilitySet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AutocycleMain 명령별 종료 코드와 출력 검증.
 *
 * <p>Capability 없이(모든 Phase 기본값) 임시 디렉토리에 기록합니다.
 * 네트워크 확인은 닫힌 로컬 포트를 대상으로 합니다.</p>
 */
class AutocycleMainTest {

    @TempDir
    Path dataDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DaemonProperties properties;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        properties = new DaemonProperties(
            dataDir,
            new SupervisorConfig(),
            new PipelineConfig().withTargetTimeoutMs(2000),
            new HealthThresholds(),
            URI.create("http://127.0.0.1:9"),
            Duration.ofMillis(200),
            20,
            5000
        );
    }

    private AutocycleMain main(Supplier<DaemonProperties> loader) {
        return new AutocycleMain(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8),
            loader,
            loaded -> new DaemonAssembly(loaded, CapabilitySet.empty(), Clock.systemUTC())
        );
    }

    private ExitCode run(String... args) {
        return main(() -> properties).run(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void 알수없는_명령이면_사용법_출력_후_2() {
        ExitCode exit = main(() -> {
            throw new AssertionError("configuration must not be loaded");
        }).run(new String[]{"deploy"});

        assertThat(exit).isEqualTo(ExitCode.INVALID_ARGS);
        assertThat(exit.code()).isEqualTo(2);
        assertThat(stderr()).contains(CliCommand.USAGE);
    }

    @Test
    void status_상태_파일이_없으면_1() {
        ExitCode exit = run("status");

        assertThat(exit).isEqualTo(ExitCode.FAILURE);
        assertThat(stderr()).contains("No status file found");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void runOnce_모든_Phase가_기본값이면_성공_리포트_출력_후_0() throws Exception {
        ExitCode exit = run("run-once");

        assertThat(exit).isEqualTo(ExitCode.SUCCESS);
        assertThat(stdout())
            .contains("\"outcome\" : \"SUCCEEDED\"")
            .contains("\"attempts\" : 1")
            .contains("\"maxRetries\" : 1")
            .contains("\"templateName\" : \"AI Productivity Template\"");
        assertThat(dataDir.resolve("system_status.json")).isRegularFile();
        try (Stream<Path> reports = Files.list(dataDir.resolve("reports"))) {
            assertThat(reports.count()).isEqualTo(1);
        }
    }

    @Test
    void status_runOnce_이후에는_저장된_상태_출력() {
        run("run-once");
        out.reset();

        ExitCode exit = run("status");

        assertThat(exit).isEqualTo(ExitCode.SUCCESS);
        assertThat(stdout()).contains("\"cycleCount\" : 1").contains("\"errorCount\" : 0");
    }

    @Test
    void status_사이클_없이_두번_조회하면_같은_내용() {
        run("run-once");
        out.reset();

        ExitCode first = run("status");
        String firstOutput = stdout();
        out.reset();
        ExitCode second = run("status");
        String secondOutput = stdout();

        assertThat(first).isEqualTo(ExitCode.SUCCESS);
        assertThat(second).isEqualTo(ExitCode.SUCCESS);
        assertThat(firstOutput).isNotBlank().isEqualTo(secondOutput);
    }

    @Test
    void health_저장된_카운터를_복원해_새로_측정() {
        run("run-once");
        out.reset();

        ExitCode exit = run("health");

        assertThat(exit).isEqualTo(ExitCode.SUCCESS);
        assertThat(stdout())
            .contains("\"cycleCount\" : 1")
            .contains("CYCLE_SUCCEEDED")
            .contains("\"networkReachable\" : false");
    }

    @Test
    void health_상태_파일이_없어도_0() {
        ExitCode exit = run("health");

        assertThat(exit).isEqualTo(ExitCode.SUCCESS);
        assertThat(stdout()).contains("\"cycleCount\" : 0");
    }

    @Test
    void 설정_로딩_실패는_치명적_오류_3() {
        ExitCode exit = main(() -> {
            throw new IllegalArgumentException("autocycle.max-retries must be a number (current: x)");
        }).run(new String[]{"run-once"});

        assertThat(exit).isEqualTo(ExitCode.FATAL);
    }

    @Test
    void 데이터_디렉토리를_준비할_수_없으면_치명적_오류_3() throws Exception {
        Path blocked = Files.writeString(dataDir.resolve("blocked"), "not a directory");
        properties = properties.withDataDirectory(blocked);

        ExitCode exit = run("run-once");

        assertThat(exit).isEqualTo(ExitCode.FATAL);
        assertThat(exit.code()).isEqualTo(3);
    }
}
