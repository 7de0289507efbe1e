package com.eyelevel.extractionpipeline.common.json.jackson;


import com.eyelevel.extractionpipeline.common.json.JsonSerializer;
import com.eyelevel.extractionpipeline.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    /**
     * Serializes a job payload (config or result map) into compact JSON.
     *
     * @param object The Java object to serialize.
     * @param <T>    The type of the Java object.
     *
     * @return The JSON representation of the object as a string.
     *
     * @throws JsonParsingException if an error occurs during JSON serialization.
     */
    @Override
    public <T> String serialize(T object) {
        log.trace("Serializing {} to JSON", object != null ? object.getClass().getSimpleName() : "null");
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
