package com.ryuqq.autocycle.adapter.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.spi.PersistenceException;
import com.ryuqq.autocycle.core.spi.ReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 슬롯마다 {@code <dataDir>/reports/cycle_yyyyMMdd_HHmmss_SSS.json} 파일 하나를 기록하는 ReportStore.
 *
 * <p>파일 이름은 리포트의 writtenAt(UTC)으로 정해지며, 같은 이름이 이미 있으면
 * {@code _1}, {@code _2} ... 접미사를 붙입니다. 참조값은 파일 이름입니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class JsonFileReportStore implements ReportStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReportStore.class);

    public static final String DIRECTORY_NAME = "reports";

    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);
    private static final Pattern FILE_NAME =
        Pattern.compile("cycle_(\\d{8}_\\d{6}_\\d{3})(?:_(\\d+))?\\.json");

    private final Path reportDirectory;
    private final ObjectMapper mapper;

    public JsonFileReportStore(Path dataDirectory) {
        this(dataDirectory, JsonMappers.create());
    }

    /**
     * 생성자.
     *
     * @param dataDirectory 데이터 디렉토리 (리포트는 하위 reports 디렉토리에 기록)
     * @param mapper JSON 매퍼
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JsonFileReportStore(Path dataDirectory, ObjectMapper mapper) {
        if (dataDirectory == null) {
            throw new IllegalArgumentException("dataDirectory cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.reportDirectory = dataDirectory.resolve(DIRECTORY_NAME);
        this.mapper = mapper;
    }

    @Override
    public void prepare() {
        try {
            Files.createDirectories(reportDirectory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create report directory " + reportDirectory, e);
        }
        if (!Files.isWritable(reportDirectory)) {
            throw new PersistenceException("Report directory is not writable: " + reportDirectory);
        }
    }

    @Override
    public synchronized String write(CycleReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        String base = "cycle_" + FILE_TIMESTAMP.format(report.writtenAt());
        Path target = reportDirectory.resolve(base + ".json");
        for (int suffix = 1; Files.exists(target); suffix++) {
            target = reportDirectory.resolve(base + "_" + suffix + ".json");
        }
        try {
            AtomicFileWriter.write(target, mapper.writeValueAsBytes(report));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write report " + target, e);
        }
        String reference = target.getFileName().toString();
        log.debug("Report written: {} ({}, {} attempts)", reference, report.outcome(), report.attempts());
        return reference;
    }

    @Override
    public synchronized Optional<CycleReport> read(String reference) {
        if (reference == null || !FILE_NAME.matcher(reference).matches()) {
            return Optional.empty();
        }
        Path file = reportDirectory.resolve(reference);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), CycleReport.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read report " + file, e);
        }
    }

    @Override
    public synchronized List<String> list() {
        if (!Files.isDirectory(reportDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(reportDirectory)) {
            return files
                .map(path -> path.getFileName().toString())
                .filter(name -> FILE_NAME.matcher(name).matches())
                .sorted(Comparator.<String, String>comparing(JsonFileReportStore::timestampOf)
                    .thenComparingInt(JsonFileReportStore::suffixOf))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Failed to list reports in " + reportDirectory, e);
        }
    }

    /**
     * 리포트 디렉토리 경로.
     */
    public Path reportDirectory() {
        return reportDirectory;
    }

    private static String timestampOf(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        return matcher.matches() ? matcher.group(1) : fileName;
    }

    private static int suffixOf(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (matcher.matches() && matcher.group(2) != null) {
            return Integer.parseInt(matcher.group(2));
        }
        return 0;
    }
}
