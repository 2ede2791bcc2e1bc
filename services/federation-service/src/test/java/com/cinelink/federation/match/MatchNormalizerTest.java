package com.cinelink.federation.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class MatchNormalizerTest {

    private final MatchNormalizer normalizer = new MatchNormalizer(false);

    @Test
    void substringDocumentPatternIsUnanchoredAndCaseInsensitive() {
        DocumentPattern pattern = normalizer.documentPattern("matrix", MatchMode.SUBSTRING_ANYWHERE);

        assertThat(pattern.regex()).isEqualTo("matrix");
        assertThat(pattern.options()).isEqualTo("i");
        assertThat(Pattern.compile(pattern.regex(), Pattern.CASE_INSENSITIVE).matcher("The Matrix Reloaded").find())
            .isTrue();
    }

    @Test
    void substringGraphPatternMatchesAnywhereInTheWholeValue() {
        String pattern = normalizer.graphPattern("matrix", MatchMode.SUBSTRING_ANYWHERE);

        assertThat(pattern).isEqualTo("(?i).*matrix.*");
        assertThat(Pattern.matches(pattern, "The Matrix Reloaded")).isTrue();
        assertThat(Pattern.matches(pattern, "Inception")).isFalse();
    }

    @Test
    void exactPatternsMatchTheWholeTitleIgnoringCase() {
        DocumentPattern document = normalizer.documentPattern("The Matrix", MatchMode.EXACT_CASE_INSENSITIVE);
        String graph = normalizer.graphPattern("The Matrix", MatchMode.EXACT_CASE_INSENSITIVE);

        Pattern compiled = Pattern.compile(document.regex(), Pattern.CASE_INSENSITIVE);
        assertThat(compiled.matcher("the matrix").find()).isTrue();
        assertThat(compiled.matcher("The Matrix Reloaded").find()).isFalse();
        assertThat(Pattern.matches(graph, "THE MATRIX")).isTrue();
        assertThat(Pattern.matches(graph, "The Matrix Revolutions")).isFalse();
    }

    @Test
    void exactPatternsQuoteMetacharacters() {
        DocumentPattern document = normalizer.documentPattern("Se7en (1995)", MatchMode.EXACT_CASE_INSENSITIVE);
        String graph = normalizer.graphPattern("Se7en (1995)", MatchMode.EXACT_CASE_INSENSITIVE);

        assertThat(Pattern.compile(document.regex(), Pattern.CASE_INSENSITIVE).matcher("se7en (1995)").find())
            .isTrue();
        assertThat(Pattern.matches(graph, "Se7en (1995)")).isTrue();
        assertThat(Pattern.matches(graph, "Se7en 1995")).isFalse();
    }

    @Test
    void substringPassesMetacharactersThroughUnlessQuotingIsEnabled() {
        assertThat(normalizer.documentPattern("Star.*Wars", MatchMode.SUBSTRING_ANYWHERE).regex())
            .isEqualTo("Star.*Wars");

        MatchNormalizer quoting = new MatchNormalizer(true);
        String graph = quoting.graphPattern("a.b", MatchMode.SUBSTRING_ANYWHERE);
        assertThat(Pattern.matches(graph, "xa.by")).isTrue();
        assertThat(Pattern.matches(graph, "xacby")).isFalse();
    }

    @Test
    void blankFragmentIsRejected() {
        assertThatThrownBy(() -> normalizer.documentPattern("  ", MatchMode.SUBSTRING_ANYWHERE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.graphPattern(null, MatchMode.EXACT_CASE_INSENSITIVE))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
