package com.furiflow.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyValueTest {

    @Test
    void render_string_wrapsInQuotesWithoutEscaping() {
        assertThat(PropertyValue.ofString("hi").render()).isEqualTo("\"hi\"");
        assertThat(PropertyValue.ofString("say \"x\"").render()).isEqualTo("\"say \"x\"\"");
    }

    @Test
    void render_boolean_usesBareWords() {
        assertThat(PropertyValue.ofBoolean(true).render()).isEqualTo("true");
        assertThat(PropertyValue.ofBoolean(false).render()).isEqualTo("false");
    }

    @Test
    void render_number_usesPlainText() {
        assertThat(PropertyValue.ofNumber(42).render()).isEqualTo("42");
        assertThat(PropertyValue.ofNumber(1.5).render()).isEqualTo("1.5");
    }

    @Test
    void constructor_literalDoesNotMatchKind_throws() {
        assertThatThrownBy(() -> new PropertyValue(ValueKind.BOOLEAN, "true"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("BOOLEAN");
    }

    @Test
    void coerceTo_numericText_returnsNumber() {
        PropertyValue coerced = PropertyValue.ofString(" 250 ").coerceTo(ValueKind.NUMBER).orElseThrow();

        assertThat(coerced.kind()).isEqualTo(ValueKind.NUMBER);
        assertThat(coerced.literal()).isEqualTo(new BigDecimal("250"));
        assertThat(coerced.render()).isEqualTo("250");
    }

    @Test
    void coerceTo_booleanText_isCaseInsensitive() {
        assertThat(PropertyValue.ofString("TRUE").coerceTo(ValueKind.BOOLEAN))
            .contains(PropertyValue.ofBoolean(true));
    }

    @Test
    void coerceTo_unconvertibleText_returnsEmpty() {
        assertThat(PropertyValue.ofString("soon").coerceTo(ValueKind.NUMBER)).isEmpty();
        assertThat(PropertyValue.ofNumber(1).coerceTo(ValueKind.BOOLEAN)).isEmpty();
    }

    @Test
    void coerceTo_string_keepsText() {
        assertThat(PropertyValue.ofBoolean(false).coerceTo(ValueKind.STRING))
            .contains(PropertyValue.ofString("false"));
    }
}
