package com.furiflow.core.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized connection, always oriented output ({@code from}) to input ({@code to}).
 *
 * @param from source endpoint
 * @param to target endpoint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionSnapshot(
    @JsonProperty("from") EndpointSnapshot from,
    @JsonProperty("to") EndpointSnapshot to
) {
    public static ConnectionSnapshot of(String fromBlock, String fromPort, String toBlock, String toPort) {
        return new ConnectionSnapshot(new EndpointSnapshot(fromBlock, fromPort), new EndpointSnapshot(toBlock, toPort));
    }

    @JsonIgnore
    public boolean isComplete() {
        return from != null && to != null && from.isComplete() && to.isComplete();
    }
}
