package com.ryuqq.autocycle.adapter.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.autocycle.core.health.HealthSnapshot;
import com.ryuqq.autocycle.core.spi.PersistenceException;
import com.ryuqq.autocycle.core.spi.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code <dataDir>/system_status.json}에 최신 스냅샷을 기록하는 StatusStore.
 *
 * <p>단일 작성자를 전제로 하며, 매 기록마다 파일 전체를 교체합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class JsonFileStatusStore implements StatusStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStatusStore.class);

    public static final String FILE_NAME = "system_status.json";

    private final Path dataDirectory;
    private final Path statusFile;
    private final ObjectMapper mapper;

    public JsonFileStatusStore(Path dataDirectory) {
        this(dataDirectory, JsonMappers.create());
    }

    /**
     * 생성자.
     *
     * @param dataDirectory 데이터 디렉토리
     * @param mapper JSON 매퍼
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JsonFileStatusStore(Path dataDirectory, ObjectMapper mapper) {
        if (dataDirectory == null) {
            throw new IllegalArgumentException("dataDirectory cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.dataDirectory = dataDirectory;
        this.statusFile = dataDirectory.resolve(FILE_NAME);
        this.mapper = mapper;
    }

    @Override
    public void prepare() {
        try {
            Files.createDirectories(dataDirectory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create data directory " + dataDirectory, e);
        }
        if (!Files.isWritable(dataDirectory)) {
            throw new PersistenceException("Data directory is not writable: " + dataDirectory);
        }
    }

    @Override
    public synchronized void write(HealthSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        try {
            AtomicFileWriter.write(statusFile, mapper.writeValueAsBytes(snapshot));
            log.debug("Status written to {} ({})", statusFile, snapshot.status().label());
        } catch (IOException e) {
            throw new PersistenceException("Failed to write status file " + statusFile, e);
        }
    }

    @Override
    public synchronized Optional<HealthSnapshot> read() {
        if (!Files.exists(statusFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(statusFile.toFile(), HealthSnapshot.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read status file " + statusFile, e);
        }
    }

    /**
     * 상태 파일 경로.
     */
    public Path statusFile() {
        return statusFile;
    }
}
