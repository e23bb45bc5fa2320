package com.furiflow.core.template;

/**
 * Kind of a parsed template segment.
 */
public enum SegmentType {
    /** Literal text copied verbatim. */
    LITERAL,
    /** {@code ${app_name}} - replaced by the manifest app id. */
    APP_NAME,
    /** {@code ${<property>}} - replaced by the rendered property value when the block has it. */
    PROPERTY,
    /** {@code ${next_code}} - replaced by the expansion of the next block in flow order. */
    CONTINUATION
}
