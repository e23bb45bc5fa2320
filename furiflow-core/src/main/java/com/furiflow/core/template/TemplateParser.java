package com.furiflow.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses code template text into {@link TemplateSegment}s.
 *
 * <p>Placeholders have the form {@code ${name}} where {@code name} is an
 * identifier. Two names are reserved:
 * <ul>
 *   <li>{@code app_name} - the application id</li>
 *   <li>{@code next_code} - the continuation of the flow</li>
 * </ul>
 * Every other name refers to a block property. Text that only looks like the
 * start of a placeholder ({@code ${} without a closing brace, or with a
 * non-identifier name) stays literal.
 */
public final class TemplateParser {

    public static final String APP_NAME = "app_name";
    public static final String NEXT_CODE = "next_code";

    static final String PLACEHOLDER_OPEN = "${";
    static final String PLACEHOLDER_CLOSE = "}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private TemplateParser() {
        // Utility class
    }

    /**
     * Parses template text.
     *
     * @param source template text
     * @return parsed template with adjacent literal text merged
     */
    public static CodeTemplate parse(String source) {
        List<TemplateSegment> segments = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(source);
        int position = 0;

        while (matcher.find()) {
            if (matcher.start() > position) {
                segments.add(TemplateSegment.literal(source.substring(position, matcher.start())));
            }
            String name = matcher.group(1);
            segments.add(new TemplateSegment(typeOf(name), name));
            position = matcher.end();
        }
        if (position < source.length()) {
            segments.add(TemplateSegment.literal(source.substring(position)));
        }

        return new CodeTemplate(source, segments);
    }

    private static SegmentType typeOf(String name) {
        return switch (name) {
            case APP_NAME -> SegmentType.APP_NAME;
            case NEXT_CODE -> SegmentType.CONTINUATION;
            default -> SegmentType.PROPERTY;
        };
    }
}
