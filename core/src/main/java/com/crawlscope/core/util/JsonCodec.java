package com.crawlscope.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/** 요청/결과 JSON 직렬화에 쓰는 공용 ObjectMapper */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {}

    public static ObjectMapper mapper() { return MAPPER; }

    public static ObjectWriter pretty() { return MAPPER.writerWithDefaultPrettyPrinter(); }
}
