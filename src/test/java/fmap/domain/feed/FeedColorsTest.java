package fmap.domain.feed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for FeedColors
 * @since 15/10/2026
 */
class FeedColorsTest {

    @ParameterizedTest
    @CsvSource({
            "FF0000FF, ff0000",
            "#FF0000, ff0000",
            "' #00ae42 ', 00ae42",
            "abc, abc"
    })
    @DisplayName("Should strip '#' and alpha and lowercase colors for comparison")
    void shouldNormalizeForCompare(String raw, String expected) {
        assertThat(FeedColors.normalizeForCompare(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should normalize a missing color to an empty string")
    void shouldNormalizeMissingColor() {
        assertThat(FeedColors.normalizeForCompare(null)).isEmpty();
        assertThat(FeedColors.normalizeForDisplay(null)).isEqualTo("#808080");
        assertThat(FeedColors.normalizeForDisplay("")).isEqualTo("#808080");
    }

    @Test
    @DisplayName("Should render display colors as uppercase #RRGGBB")
    void shouldNormalizeForDisplay() {
        assertThat(FeedColors.normalizeForDisplay("00ae42ff")).isEqualTo("#00AE42");
    }

    @Test
    @DisplayName("Should compare channels against the tolerance")
    void shouldDetectSimilarColors() {
        assertThat(FeedColors.areSimilar("#000000", "282828FF", 40)).isTrue();
        assertThat(FeedColors.areSimilar("#000000", "292828", 40)).isFalse();
        assertThat(FeedColors.areSimilar("#000000", "000000", 0)).isFalse();
    }

    @Test
    @DisplayName("Should never consider malformed colors similar")
    void shouldRejectMalformedColors() {
        assertThat(FeedColors.areSimilar("#00000", "000000", 40)).isFalse();
        assertThat(FeedColors.areSimilar("zzzzzz", "000000", 40)).isFalse();
        assertThat(FeedColors.areSimilar(null, "000000", 40)).isFalse();
    }

    @Test
    @DisplayName("Should compare materials case-insensitively")
    void shouldCompareMaterials() {
        assertThat(FeedColors.sameMaterial("PLA", " pla ")).isTrue();
        assertThat(FeedColors.sameMaterial("PLA", "PETG")).isFalse();
        assertThat(FeedColors.sameMaterial("", "")).isFalse();
        assertThat(FeedColors.sameMaterial(null, "PLA")).isFalse();
    }
}
