package com.eyelevel.extractionpipeline.common.json;

import java.util.Map;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Implementations of this interface handle the details of JSON parsing using a specific JSON
 * library (e.g., Jackson, Gson).
 */
public interface JsonParser {

    /**
     * Parses a JSON object into an ordered map. Blank input yields an empty map.
     *
     * @param json The JSON object as a string.
     *
     * @return The parsed map, never {@code null}.
     *
     * @throws com.eyelevel.extractionpipeline.exception.json.JsonParsingException if the input is not a JSON object.
     */
    Map<String, Object> parseMap(String json);
}
