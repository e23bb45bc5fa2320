package com.furiflow.core.model;

/**
 * Direction of a connector relative to its owning block.
 */
public enum ConnectorDirection {
    INPUT,
    OUTPUT
}
