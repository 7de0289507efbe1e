package com.eyelevel.extractionpipeline.common.json.jackson;


import com.eyelevel.extractionpipeline.common.json.JsonParser;
import com.eyelevel.extractionpipeline.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 *
 * <p>It leverages the {@link ObjectMapper} from the Jackson library to perform the JSON parsing.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public Map<String, Object> parseMap(String json) {
        if (!StringUtils.hasText(json)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> result = objectMapper.readValue(json, MAP_TYPE);
            return result != null ? result : new LinkedHashMap<>();
        } catch (IOException e) {
            log.error("Error parsing JSON string to map", e);
            throw new JsonParsingException("Error parsing JSON string to map", e);
        }
    }
}
