package com.strataconf.core.cli;

import com.strataconf.core.error.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ArgumentParser}.
 */
class ArgumentParserTest {

    @Test
    @DisplayName("Should collect --load files in encounter order")
    void loadFiles() {
        ParsedArguments parsed = ArgumentParser.parse("--load", "/etc/a.yaml", "x=1", "--load", "b.json");

        assertThat(parsed.getAdditionalFiles()).containsExactly("/etc/a.yaml", "b.json");
        assertThat(parsed.getOverrides()).isEqualTo(Map.of("x", "1"));
    }

    @Test
    @DisplayName("Should split paths on slashes and keep values as strings")
    void nestedPaths() {
        ParsedArguments parsed = ArgumentParser.parse("web-server/port=8080", "web-server/host=0.0.0.0",
                "db/pool/size=10");

        assertThat(parsed.getOverrides()).isEqualTo(Map.of(
                "web-server", Map.of("port", "8080", "host", "0.0.0.0"),
                "db", Map.of("pool", Map.of("size", "10"))));
    }

    @Test
    @DisplayName("Tokens sharing a prefix extend the same nested map")
    void sharedPrefixes() {
        ParsedArguments parsed = ArgumentParser.parse("a/b/c=1", "a/e=3", "a/b/d=2");

        assertThat(parsed.getOverrides()).isEqualTo(Map.of(
                "a", Map.of("b", Map.of("c", "1", "d", "2"), "e", "3")));
    }

    @Test
    @DisplayName("Later token for the same path wins")
    void lastTokenWins() {
        ParsedArguments parsed = ArgumentParser.parse("port=1", "port=2");

        assertThat(parsed.getOverrides()).isEqualTo(Map.of("port", "2"));
    }

    @Test
    @DisplayName("Deeper path replaces an earlier scalar")
    void deeperPathReplacesScalar() {
        ParsedArguments parsed = ArgumentParser.parse("db=none", "db/host=x");

        assertThat(parsed.getOverrides()).isEqualTo(Map.of("db", Map.of("host", "x")));
    }

    @Test
    @DisplayName("Value may contain '=' and may be empty")
    void valueContents() {
        ParsedArguments parsed = ArgumentParser.parse("jdbc/url=jdbc:h2:mem:test;MODE=PostgreSQL", "token=");

        assertThat(parsed.getOverrides())
                .containsEntry("jdbc", Map.of("url", "jdbc:h2:mem:test;MODE=PostgreSQL"))
                .containsEntry("token", "");
    }

    @Test
    @DisplayName("Should reject a token without '='")
    void rejectBareToken() {
        assertThatThrownBy(() -> ArgumentParser.parse("verbose"))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.getToken()).isEqualTo("verbose"))
                .hasMessageContaining("Unable to parse argument");
    }

    @Test
    @DisplayName("Should reject a token with an empty path")
    void rejectEmptyPath() {
        assertThatThrownBy(() -> ArgumentParser.parse("=value")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ArgumentParser.parse("/=value")).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Should reject --load without a path")
    void rejectDanglingLoad() {
        assertThatThrownBy(() -> ArgumentParser.parse("x=1", "--load"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("--load");
    }

    @Test
    @DisplayName("No arguments yields nothing")
    void empty() {
        assertThat(ArgumentParser.parse(List.of()).getAdditionalFiles()).isEmpty();
        assertThat(ArgumentParser.parse((List<String>) null).getOverrides()).isEmpty();
    }
}
