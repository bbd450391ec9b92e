package org.example.pysolver.requirement;

import org.example.pysolver.exception.RequirementParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RequirementParser.
 */
class RequirementParserTest {

    private final RequirementParser parser = new RequirementParser();

    @Nested
    @DisplayName("Valid Requirements")
    class ValidRequirements {

        @Test
        @DisplayName("should parse bare name")
        void shouldParseBareName() throws RequirementParseException {
            Requirement requirement = parser.parse("flask");

            assertThat(requirement.getName()).isEqualTo("flask");
            assertThat(requirement.getSpecifiers()).isEmpty();
            assertThat(requirement.getVersionSpec()).isEmpty();
        }

        @Test
        @DisplayName("should parse ordered specifiers")
        void shouldParseSpecifiers() throws RequirementParseException {
            Requirement requirement = parser.parse("foo>=1.0,<2.0");

            assertThat(requirement.getSpecifiers()).containsExactly(
                    new VersionSpecifier(">=", "1.0"),
                    new VersionSpecifier("<", "2.0"));
            assertThat(requirement.getVersionSpec()).isEqualTo(">=1.0,<2.0");
        }

        @Test
        @DisplayName("should parse extras, whitespace and markers")
        void shouldParseExtrasAndMarker() throws RequirementParseException {
            Requirement requirement = parser.parse("requests [socks, security] >= 2.8 ; python_version >= \"3.6\"");

            assertThat(requirement.getName()).isEqualTo("requests");
            assertThat(requirement.getExtras()).containsExactly("socks", "security");
            assertThat(requirement.getVersionSpec()).isEqualTo(">=2.8");
            assertThat(requirement.getMarker()).isEqualTo("python_version >= \"3.6\"");
        }

        @Test
        @DisplayName("should parse parenthesized specifiers")
        void shouldParseParenthesized() throws RequirementParseException {
            assertThat(parser.parse("six (>=1.10,<2)").getVersionSpec()).isEqualTo(">=1.10,<2");
        }

        @Test
        @DisplayName("should parse wildcard and arbitrary equality")
        void shouldParseWildcardAndArbitraryEquality() throws RequirementParseException {
            assertThat(parser.parse("django==3.2.*").getSpecifiers().get(0).isWildcard()).isTrue();
            assertThat(parser.parse("odd===foobar").getVersionSpec()).isEqualTo("===foobar");
        }
    }

    @Nested
    @DisplayName("Invalid Requirements")
    class InvalidRequirements {

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "-flask",
                "foo>=",
                "foo=>1.0",
                "foo>=1.0,",
                "foo>=1.*",
                "foo~=1",
                "foo==not-a-version",
                "foo==99999999999999999999",
                "foo (>=1.0",
                "foo[bad extra]",
                "foo @ https://example.com/foo.whl",
                "foo;"
        })
        @DisplayName("should reject malformed requirement")
        void shouldRejectMalformed(String raw) {
            assertThatThrownBy(() -> parser.parse(raw))
                    .isInstanceOf(RequirementParseException.class)
                    .satisfies(e -> assertThat(((RequirementParseException) e).getRequirement()).isEqualTo(raw));
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertThatThrownBy(() -> parser.parse(null))
                    .isInstanceOf(RequirementParseException.class)
                    .hasMessageContaining("cannot be null or empty");
        }
    }
}
