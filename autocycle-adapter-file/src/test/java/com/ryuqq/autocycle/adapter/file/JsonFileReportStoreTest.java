package com.ryuqq.autocycle.adapter.file;

import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.report.SlotOutcome;
import com.ryuqq.autocycle.testkit.fixture.CycleFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileReportStoreTest {

    @TempDir
    Path dataDir;

    private JsonFileReportStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileReportStore(dataDir);
        store.prepare();
    }

    @Test
    void write_reports_디렉토리에_시각_기반_파일명으로_기록() {
        String reference = store.write(CycleFixtures.report(SlotOutcome.SUCCEEDED, 1));

        assertThat(reference).isEqualTo("cycle_20250115_100200_000.json");
        assertThat(dataDir.resolve("reports").resolve(reference)).isRegularFile();
    }

    @Test
    void write_같은_파일명이_있으면_숫자_접미사() {
        CycleReport report = CycleFixtures.report(SlotOutcome.SUCCEEDED, 1);

        String first = store.write(report);
        String second = store.write(report);
        String third = store.write(report);

        assertThat(first).isEqualTo("cycle_20250115_100200_000.json");
        assertThat(second).isEqualTo("cycle_20250115_100200_000_1.json");
        assertThat(third).isEqualTo("cycle_20250115_100200_000_2.json");
    }

    @Test
    void list_접미사는_숫자_순서로_정렬() {
        CycleReport report = CycleFixtures.report(SlotOutcome.EXHAUSTED, 3);
        for (int i = 0; i < 12; i++) {
            store.write(report);
        }

        assertThat(store.list()).hasSize(12);
        assertThat(store.list().get(2)).isEqualTo("cycle_20250115_100200_000_2.json");
        assertThat(store.list().get(11)).isEqualTo("cycle_20250115_100200_000_11.json");
    }

    @Test
    void list_리포트가_아닌_파일은_제외() throws Exception {
        store.write(CycleFixtures.report(SlotOutcome.SUCCEEDED, 1));
        Files.writeString(dataDir.resolve("reports").resolve("notes.txt"), "ignored");

        assertThat(store.list()).containsExactly("cycle_20250115_100200_000.json");
    }

    @Test
    void write_가격은_소수점_자리를_유지() throws Exception {
        String reference = store.write(CycleFixtures.report(SlotOutcome.SUCCEEDED, 1));

        String json = Files.readString(dataDir.resolve("reports").resolve(reference), StandardCharsets.UTF_8);
        CycleReport read = store.read(reference).orElseThrow();

        assertThat(json).contains("\"amount\" : 49.00");
        assertThat(read.result().finalPrice().amount()).isEqualTo(new BigDecimal("49.00"));
    }

    @Test
    void read_경로_탐색_참조는_빈_결과() {
        assertThat(store.read("../system_status.json")).isEmpty();
        assertThat(store.read(null)).isEmpty();
    }
}
