package com.weave.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PathTemplate")
class PathTemplateTest {

    @Nested
    @DisplayName("match()")
    class Match {

        @Test
        @DisplayName("extracts an int segment")
        void intSegment() {
            PathParameters params = PathTemplate.compile("/user/{id:int}").match("/user/42").orElseThrow();

            assertThat(params.getInt("id")).isEqualTo(42);
            assertThat(params.asMap()).containsEntry("id", 42);
        }

        @Test
        @DisplayName("treats int overflow as no match")
        void intOverflow() {
            assertThat(PathTemplate.compile("/user/{id:int}").match("/user/2147483648")).isEmpty();
            assertThat(PathTemplate.compile("/user/{id:long}").match("/user/2147483648")).isPresent();
        }

        @Test
        @DisplayName("converts every supported type")
        void allTypes() {
            UUID id = UUID.fromString("3f2b8c1e-9a4d-4c8e-b1a2-0d9e8f7a6b5c");
            PathParameters params = PathTemplate
                    .compile("/{a:int}/{b:long}/{c:double}/{d:bool}/{e:string}/{f:uuid}/{g}")
                    .match("/1/9000000000/2.5/TRUE/text/" + id + "/plain")
                    .orElseThrow();

            assertThat(params.getInt("a")).isEqualTo(1);
            assertThat(params.getLong("b")).isEqualTo(9_000_000_000L);
            assertThat(params.getDouble("c")).isEqualTo(2.5);
            assertThat(params.getBool("d")).isTrue();
            assertThat(params.getString("e")).isEqualTo("text");
            assertThat(params.getUuid("f")).isEqualTo(id);
            assertThat(params.getString("g")).isEqualTo("plain");
        }

        @Test
        @DisplayName("accepts only ASCII digits with an optional minus for integral segments")
        void integralFormat() {
            PathTemplate template = PathTemplate.compile("/user/{id:int}");

            assertThat(template.match("/user/-7").orElseThrow().getInt("id")).isEqualTo(-7);
            assertThat(template.match("/user/+42")).isEmpty();
            assertThat(template.match("/user/\u0664\u0662")).isEmpty();
            assertThat(template.match("/user/-")).isEmpty();
            assertThat(PathTemplate.compile("/n/{n:long}").match("/n/+9000000000")).isEmpty();
        }

        @Test
        @DisplayName("accepts only plain decimal notation for double segments")
        void decimalFormat() {
            PathTemplate template = PathTemplate.compile("/x/{v:double}");

            assertThat(template.match("/x/-1.25").orElseThrow().getDouble("v")).isEqualTo(-1.25);
            assertThat(template.match("/x/3").orElseThrow().getDouble("v")).isEqualTo(3.0);
            assertThat(template.match("/x/NaN")).isEmpty();
            assertThat(template.match("/x/Infinity")).isEmpty();
            assertThat(template.match("/x/1d")).isEmpty();
            assertThat(template.match("/x/0x1p3")).isEmpty();
            assertThat(template.match("/x/1e3")).isEmpty();
        }

        @Test
        @DisplayName("falls through on a segment that does not convert")
        void badConversion() {
            assertThat(PathTemplate.compile("/user/{id:int}").match("/user/abc")).isEmpty();
            assertThat(PathTemplate.compile("/flag/{on:bool}").match("/flag/yes")).isEmpty();
            assertThat(PathTemplate.compile("/doc/{id:uuid}").match("/doc/not-a-uuid")).isEmpty();
        }

        @Test
        @DisplayName("requires the same number of segments")
        void segmentCount() {
            PathTemplate template = PathTemplate.compile("/user/{id:int}");

            assertThat(template.match("/user")).isEmpty();
            assertThat(template.match("/user/1/extra")).isEmpty();
            assertThat(template.match("/user/")).isEmpty();
        }

        @Test
        @DisplayName("matches literal segments case-sensitively")
        void literals() {
            PathTemplate template = PathTemplate.compile("/user/{id:int}");

            assertThat(template.match("/User/1")).isEmpty();
            assertThat(PathTemplate.compile("/").match("/")).isPresent();
        }
    }

    @Nested
    @DisplayName("compile()")
    class Compile {

        @Test
        @DisplayName("rejects an unknown type")
        void unknownType() {
            assertThatThrownBy(() -> PathTemplate.compile("/user/{id:date}"))
                    .isInstanceOf(PathTemplate.InvalidTemplateException.class)
                    .hasMessageContaining("date");
        }

        @Test
        @DisplayName("rejects duplicate parameter names")
        void duplicates() {
            assertThatThrownBy(() -> PathTemplate.compile("/{id}/{id:int}"))
                    .isInstanceOf(PathTemplate.InvalidTemplateException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("rejects stray braces")
        void strayBraces() {
            assertThatThrownBy(() -> PathTemplate.compile("/user/{id"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PathTemplate.compile("/user/x{id}"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("requires a leading slash")
        void leadingSlash() {
            assertThatThrownBy(() -> PathTemplate.compile("user/{id}"))
                    .isInstanceOf(PathTemplate.InvalidTemplateException.class);
        }
    }
}
