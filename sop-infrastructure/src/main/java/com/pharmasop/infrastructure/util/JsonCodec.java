package com.pharmasop.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmasop.types.enums.ResponseCode;
import com.pharmasop.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSONB 列编解码工具。
 *
 * @author pharmasop
 * @since 2026-10-01
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<String>> STRING_LIST_REF = new TypeReference<List<String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    public List<String> readStringList(String json) {
        return readValue(json, STRING_LIST_REF);
    }

    /**
     * 读取 JSON 为指定类型，空串返回 null。
     */
    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    public <T> T readValue(String json, Class<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json as " + type.getSimpleName(), ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}
