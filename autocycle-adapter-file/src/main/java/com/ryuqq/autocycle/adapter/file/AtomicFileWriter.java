package com.ryuqq.autocycle.adapter.file;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 임시 파일 기록 후 이동으로 파일을 교체.
 *
 * <p>읽는 쪽은 이전 내용 전체 또는 새 내용 전체만 보게 됩니다.
 * 파일 시스템이 원자적 이동을 지원하지 않으면 일반 교체로 대체합니다.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
final class AtomicFileWriter {

    private AtomicFileWriter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 파일을 주어진 내용으로 교체.
     *
     * @param target 대상 파일 (부모 디렉토리가 존재해야 함)
     * @param content 기록할 내용
     * @throws IOException 기록 또는 이동 실패 시 (임시 파일은 삭제됨)
     */
    static void write(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        boolean moved = false;
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }
}
