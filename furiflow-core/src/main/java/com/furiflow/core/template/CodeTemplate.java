package com.furiflow.core.template;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A block type's code template, parsed once into an ordered list of segments.
 *
 * @param source original template text
 * @param segments parsed segments in source order
 */
public record CodeTemplate(
    String source,
    List<TemplateSegment> segments
) {
    private static final CodeTemplate EMPTY = new CodeTemplate("", List.of());

    /**
     * Compact constructor with validation.
     */
    public CodeTemplate {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    public static CodeTemplate empty() {
        return EMPTY;
    }

    /**
     * Parses template text.
     *
     * @param source template text, null is treated as empty
     * @return parsed template
     */
    public static CodeTemplate parse(String source) {
        return source == null || source.isEmpty() ? EMPTY : TemplateParser.parse(source);
    }

    public boolean isEmpty() {
        return source.isEmpty();
    }

    public boolean hasContinuation() {
        return segments.stream().anyMatch(s -> s.type() == SegmentType.CONTINUATION);
    }

    /**
     * Returns the property names referenced by the template, in first-use order.
     *
     * @return referenced property names
     */
    public Set<String> propertyNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TemplateSegment segment : segments) {
            if (segment.type() == SegmentType.PROPERTY) {
                names.add(segment.text());
            }
        }
        return names;
    }
}
