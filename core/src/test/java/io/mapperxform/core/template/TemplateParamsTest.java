package io.mapperxform.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TemplateParamsTest {

    @Nested
    class ExtractParams {

        @Test
        void returnsDistinctNamesInOrderOfFirstAppearance() {
            assertThat(TemplateParams.extractParams("{b}/{a}/{b}/{_c1}")).containsExactly("b", "a", "_c1");
        }

        @Test
        void ignoresMalformedPlaceholders() {
            assertThat(TemplateParams.extractParams("{1x} {} {ok} {a-b}")).containsExactly("ok");
        }

        @Test
        void nullOrEmptyTemplateHasNoParams() {
            assertThat(TemplateParams.extractParams(null)).isEmpty();
            assertThat(TemplateParams.extractParams("")).isEmpty();
        }
    }

    @Nested
    class Validate {

        @Test
        void acceptsWellFormedTemplate() {
            TemplateValidation result = TemplateParams.validate("http://{host}/api/{id}");

            assertThat(result.valid()).isTrue();
            assertThat(result.errorMessage()).isEmpty();
        }

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                value = {
                    "'   '            | Template cannot be empty",
                    "http://{host     | Unmatched braces in template",
                    "http://{1host}   | 'Invalid parameter name: {1host}'",
                    "a{}b             | Empty parameter names are not allowed",
                })
        void rejectsMalformedTemplates(String template, String reason) {
            TemplateValidation result = TemplateParams.validate(template);

            assertThat(result.valid()).isFalse();
            assertThat(result.errorMessage()).contains(reason);
        }

        @Test
        void nullTemplateIsEmpty() {
            assertThat(TemplateParams.validate(null).error()).isEqualTo("Template cannot be empty");
        }
    }

    @Nested
    class Resolve {

        @Test
        void replacesEveryOccurrence() {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("id", 42);
            values.put("host", "example.org");

            assertThat(TemplateParams.resolve("{host}/{id}?again={id}", values))
                    .isEqualTo("example.org/42?again=42");
        }

        @Test
        void treatsReplacementTextLiterally() {
            assertThat(TemplateParams.resolve("cost: {amount}", Map.of("amount", "$1.00\\")))
                    .isEqualTo("cost: $1.00\\");
        }

        @Test
        void leavesUnknownPlaceholdersUntouched() {
            assertThat(TemplateParams.resolve("{a}-{b}", Map.of("a", "x"))).isEqualTo("x-{b}");
        }
    }

    @Test
    void displayNameCapitalizesFirstLetter() {
        assertThat(TemplateParams.displayName("hostname")).isEqualTo("Hostname");
        assertThat(TemplateParams.displayName("")).isEmpty();
        assertThat(TemplateParams.displayName(null)).isEmpty();
    }

    @Test
    void splitAlternatesLiteralAndParameterSegments() {
        List<TemplateParams.Segment> segments = TemplateParams.split("http://{host}/api/{id}");

        assertThat(segments)
                .containsExactly(
                        new TemplateParams.Segment("http://", -1),
                        new TemplateParams.Segment("host", 0),
                        new TemplateParams.Segment("/api/", -1),
                        new TemplateParams.Segment("id", 1));
    }

    @Test
    void splitKeepsRepeatedPlaceholderInLiteralText() {
        List<TemplateParams.Segment> segments = TemplateParams.split("{a}-{a}");

        assertThat(segments)
                .containsExactly(new TemplateParams.Segment("a", 0), new TemplateParams.Segment("-{a}", -1));
    }
}
