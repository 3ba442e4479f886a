package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.WorkflowStep;
import java.util.List;

/// Serializes flowcharts, step lists and other isoflow values to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = FlowchartJson.toJson(flowchart);
/// Flowchart restored = FlowchartJson.fromJson(json);
/// }
///
/// @implNote Thread-safe. A new mapper is created per call; cache
/// {@link #createMapper()} for high-throughput use.
///
/// @see IsoflowJacksonModule for the registered type handlers
public final class FlowchartJson {

    private static final TypeReference<List<WorkflowStep>> STEP_LIST = new TypeReference<>() {};

    private FlowchartJson() {}

    /// Serializes a flowchart to pretty-printed JSON.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Flowchart flowchart) {
        return write(flowchart, "flowchart");
    }

    /// Deserializes a flowchart.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed or describes an invalid graph
    public static Flowchart fromJson(String json) {
        try {
            return createMapper().readValue(json, Flowchart.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize flowchart: " + e.getMessage(), e);
        }
    }

    /// Serializes an extracted step list.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String stepsToJson(List<WorkflowStep> steps) {
        return write(steps, "steps");
    }

    /// Deserializes a step list written by {@link #stepsToJson(List)}.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed
    public static List<WorkflowStep> stepsFromJson(String json) {
        try {
            return createMapper().readValue(json, STEP_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize steps: " + e.getMessage(), e);
        }
    }

    /// Serializes any isoflow value, such as a validation result or job snapshot.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        return write(value, value == null ? "null" : value.getClass().getSimpleName());
    }

    /// Creates an ObjectMapper configured for isoflow types.
    ///
    /// Registers:
    /// - `IsoflowJacksonModule` for the flowchart model
    /// - `JavaTimeModule` for job timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new IsoflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
