package com.strataconf.core.property;

import com.strataconf.core.error.UnresolvedPropertyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PropertyExpander}.
 */
class PropertyExpanderTest {

    private final PropertyResolver resolver = new PropertyResolver(
            EnvironmentSnapshot.ofProperties(Map.of("DB_HOST", "prod", "price", "$5\\off")));

    @Test
    @DisplayName("Expands references and falls back to defaults")
    void expandsWithDefault() {
        assertThat(PropertyExpander.expand("jdbc://${DB_HOST}:${DB_PORT:5432}", resolver))
                .isEqualTo("jdbc://prod:5432");
    }

    @Test
    @DisplayName("Known value wins over the default")
    void valueBeatsDefault() {
        assertThat(PropertyExpander.expand("${DB_HOST:localhost}", resolver)).isEqualTo("prod");
    }

    @Test
    @DisplayName("Empty default is a legal fallback")
    void emptyDefault() {
        assertThat(PropertyExpander.expand("password: '${DB_PASSWORD:}'", resolver))
                .isEqualTo("password: ''");
    }

    @Test
    @DisplayName("Default keeps everything after the first colon")
    void defaultWithColons() {
        assertThat(PropertyExpander.expand("${URL:http://localhost:8080}", resolver))
                .isEqualTo("http://localhost:8080");
    }

    @Test
    @DisplayName("Replacement values are inserted literally")
    void literalReplacement() {
        assertThat(PropertyExpander.expand("cost: ${price}", resolver)).isEqualTo("cost: $5\\off");
    }

    @Test
    @DisplayName("References may appear in key positions")
    void keyPosition() {
        assertThat(PropertyExpander.expand("${DB_HOST}:\n  enabled: true", resolver))
                .isEqualTo("prod:\n  enabled: true");
    }

    @Test
    @DisplayName("Nested references are not expanded recursively")
    void noNesting() {
        assertThat(PropertyExpander.expand("${${DB_HOST}}", resolver)).isEqualTo("${prod}");
    }

    @Test
    @DisplayName("Text without references is returned unchanged")
    void noReferences() {
        assertThat(PropertyExpander.expand("plain: $HOME {x}", resolver)).isEqualTo("plain: $HOME {x}");
    }

    @Test
    @DisplayName("Missing reference without default fails with context")
    void unresolved() {
        String source = "secret: ${MISSING}";

        assertThatThrownBy(() -> PropertyExpander.expand(source, resolver))
                .isInstanceOfSatisfying(UnresolvedPropertyException.class, e -> {
                    assertThat(e.getPropertyName()).isEqualTo("MISSING");
                    assertThat(e.getKnownKeys()).containsExactly("DB_HOST", "price");
                    assertThat(e.getSource()).contains(source);
                })
                .hasMessageContaining("MISSING");
    }
}
