package com.ryuqq.autocycle.adapter.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 상태/리포트 파일용 ObjectMapper 생성.
 *
 * <ul>
 *   <li>Instant, Duration은 ISO-8601 문자열</li>
 *   <li>들여쓰기 출력</li>
 *   <li>알 수 없는 필드는 읽을 때 무시</li>
 * </ul>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 ObjectMapper 생성.
     *
     * @return 설정된 ObjectMapper
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
