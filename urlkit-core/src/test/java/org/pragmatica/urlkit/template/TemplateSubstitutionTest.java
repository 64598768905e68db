package org.pragmatica.urlkit.template;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateSubstitutionTest {

    @Test
    void substitute_knownVariables_replacesEveryOccurrence() {
        var result = TemplateSubstitution.substitute("{a}/{b}/{a}", Map.of("a", "x", "b", "y"));

        assertThat(result).isEqualTo("x/y/x");
    }

    @Test
    void substitute_unknownVariable_leftAsLiteral() {
        var result = TemplateSubstitution.substitute("{host}/{section}", Map.of("host", "example.com"));

        assertThat(result).isEqualTo("example.com/{section}");
    }

    @Test
    void substitute_valueContainingPlaceholder_isNotExpandedAgain() {
        var result = TemplateSubstitution.substitute("{a}-{b}", Map.of("a", "{b}", "b", "secret"));

        assertThat(result).isEqualTo("{b}-secret");
    }

    @Test
    void substitute_unbalancedBraces_keptVerbatim() {
        assertThat(TemplateSubstitution.substitute("{open/{a}", Map.of("a", "1"))).isEqualTo("{open/1");
        assertThat(TemplateSubstitution.substitute("tail{", Map.of())).isEqualTo("tail{");
    }

    @Test
    void missingVariables_returnsSortedDistinctNames() {
        var missing = TemplateSubstitution.missingVariables("{z}{a}{z}{host}{route_path}",
                                                            Map.of("host", "h", "route_path", "/"));

        assertThat(missing).containsExactly("a", "z");
    }

    @Test
    void missingVariables_ignoresNonIdentifierBraces() {
        assertThat(TemplateSubstitution.missingVariables("{not-a-var}{ok}", Map.of("ok", "1"))).isEmpty();
    }
}
