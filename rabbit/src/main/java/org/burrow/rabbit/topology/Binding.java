package org.burrow.rabbit.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A binding as reported by the management API.
 *
 * <p>{@code propertiesKey} is already URL-escaped by the broker and is used verbatim when
 * deleting the binding.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Binding(
        @JsonProperty("source") String source,
        @JsonProperty("vhost") String vhost,
        @JsonProperty("destination") String destination,
        @JsonProperty("destination_type") String destinationType,
        @JsonProperty("routing_key") String routingKey,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("properties_key") String propertiesKey
) {
    /**
     * The implicit binding from the default exchange has an empty source.
     */
    public boolean hasSource() {
        return source != null && !source.isEmpty();
    }
}
