package com.furiflow.core.template;

import java.util.Objects;

/**
 * One node of a parsed code template.
 *
 * @param type segment kind
 * @param text literal text for {@link SegmentType#LITERAL}, otherwise the placeholder name
 */
public record TemplateSegment(
    SegmentType type,
    String text
) {
    /**
     * Compact constructor with validation.
     */
    public TemplateSegment {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static TemplateSegment literal(String text) {
        return new TemplateSegment(SegmentType.LITERAL, text);
    }

    /**
     * Returns the placeholder exactly as written in the template source.
     *
     * @return {@code ${name}} for placeholders, the text itself for literals
     */
    public String sourceText() {
        return type == SegmentType.LITERAL ? text : TemplateParser.PLACEHOLDER_OPEN + text + TemplateParser.PLACEHOLDER_CLOSE;
    }
}
