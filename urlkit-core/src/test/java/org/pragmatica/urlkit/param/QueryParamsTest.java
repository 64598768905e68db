package org.pragmatica.urlkit.param;

import org.junit.jupiter.api.Test;
import org.pragmatica.urlkit.RoutingError;
import org.pragmatica.urlkit.UrlKitException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryParamsTest {

    @Test
    void queryParams_singleThenMulti_eachGroupSortedByKey() {
        var params = QueryParams.queryParams(Map.of("z", "1", "a", "2"),
                                             Map.of("y", List.of("3", "4"), "b", List.of("5")));

        assertThat(params.encode()).isEqualTo("a=2&z=1&b=5&y=3&y=4");
    }

    @Test
    void queryParams_emptyMultiValue_emitsKeyOnce() {
        var params = QueryParams.queryParams(Map.of(), Map.of("flag", List.of()));

        assertThat(params.encode()).isEqualTo("flag=");
    }

    @Test
    void encode_reservedCharacters_areFormEncoded() {
        var params = QueryParams.queryParams(Map.of("q", "a b&c=d", "name", "José"));

        assertThat(params.encode()).isEqualTo("name=Jos%C3%A9&q=a+b%26c%3Dd");
    }

    @Test
    void encode_tildeKeptAndAsteriskEscaped() {
        var params = QueryParams.queryParams(Map.of("v", "~user*"));

        assertThat(params.encode()).isEqualTo("v=~user%2A");
    }

    @Test
    void accessors_reflectPairs() {
        var params = QueryParams.queryParams(Map.of("lang", "en"), Map.of("tag", List.of("a", "b")));

        assertThat(params.get("lang")).contains("en");
        assertThat(params.get("missing")).isEmpty();
        assertThat(params.getAll("tag")).containsExactly("a", "b");
        assertThat(params.has("tag")).isTrue();
        assertThat(params.asMap()).containsExactly(Map.entry("lang", List.of("en")),
                                                   Map.entry("tag", List.of("a", "b")));
    }

    @Test
    void empty_hasNoPairs() {
        assertThat(QueryParams.empty()
                              .isEmpty()).isTrue();
        assertThat(QueryParams.empty()
                              .encode()).isEmpty();
    }

    @Test
    void from_mapWithMixedValues_splitsSingleAndMulti() throws UrlKitException {
        var input = new LinkedHashMap<String, Object>();
        input.put("page", 2);
        input.put("tags", List.of("x", "y"));
        input.put("ids", new int[]{3, 1});
        input.put("empty", null);

        var params = QueryParams.from(input);

        assertThat(params.encode()).isEqualTo("empty=&page=2&ids=3&ids=1&tags=x&tags=y");
    }

    @Test
    void from_unsupportedInput_fails() {
        assertThatThrownBy(() -> QueryParams.from("a=1"))
            .isInstanceOfSatisfying(UrlKitException.class,
                                    e -> assertThat(e.error()).isInstanceOf(RoutingError.UnsupportedQuery.class));
    }
}
