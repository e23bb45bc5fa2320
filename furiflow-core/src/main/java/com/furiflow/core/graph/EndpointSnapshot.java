package com.furiflow.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.furiflow.core.model.PortRef;

/**
 * Serialized connection endpoint.
 *
 * @param block block id
 * @param port port id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointSnapshot(
    @JsonProperty("block") String block,
    @JsonProperty("port") String port
) {
    public static EndpointSnapshot of(PortRef ref) {
        return new EndpointSnapshot(ref.blockId(), ref.portId());
    }

    /**
     * Checks that both fields are present.
     *
     * @return true if block and port are non-blank
     */
    @JsonIgnore
    public boolean isComplete() {
        return block != null && !block.isBlank() && port != null && !port.isBlank();
    }
}
