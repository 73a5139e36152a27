package fmap.domain.mapping;

import fmap.common.EHtSlotIdConvention;
import fmap.domain.feed.ExternalFeed;
import fmap.domain.feed.ExtruderTopology;
import fmap.domain.feed.FeedSlot;
import fmap.domain.feed.FeedSnapshot;
import fmap.domain.feed.FeedUnit;
import fmap.domain.feed.InventoryNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RequirementMatcher
 * @since 15/10/2026
 */
class RequirementMatcherTest {

    private final RequirementMatcher matcher = new RequirementMatcher();

    private static FilamentRequirement req(int slotId, String type, String color) {
        return FilamentRequirement.of(slotId, type, color, 10.0);
    }

    private static Optional<FeedSnapshot> units(FeedUnit... units) {
        return Optional.of(FeedSnapshot.of(List.of(units)));
    }

    private static List<Integer> mapping(RequirementMatcher matcher, List<FilamentRequirement> reqs, Optional<FeedSnapshot> snapshot) {
        return matcher.match(reqs, snapshot).orElseThrow().slotIds();
    }

    private List<Integer> mapping(List<FilamentRequirement> reqs, Optional<FeedSnapshot> snapshot) {
        return mapping(matcher, reqs, snapshot);
    }

    @Nested
    @DisplayName("Absence")
    class Absence {

        @Test
        @DisplayName("Should return no result for absent or empty requirements")
        void shouldReturnEmptyForNoRequirements() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000")));

            // When & Then
            assertThat(matcher.match(null, status)).isEmpty();
            assertThat(matcher.match(List.of(), status)).isEmpty();
        }

        @Test
        @DisplayName("Should return no result when nothing is loaded")
        void shouldReturnEmptyForEmptyInventory() {
            // Given
            List<FilamentRequirement> reqs = List.of(req(1, "PLA", "#FF0000"));

            // When & Then
            assertThat(matcher.match(reqs, Optional.empty())).isEmpty();
            assertThat(matcher.match(reqs, (FeedSnapshot) null)).isEmpty();
            assertThat(matcher.match(reqs, units())).isEmpty();
            assertThat(matcher.match(reqs, units(FeedUnit.of(0, FeedSlot.empty(0), FeedSlot.empty(1))))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tiers")
    class Tiers {

        @Test
        @DisplayName("Should prefer the spool fingerprint over an earlier slot with the same color")
        void shouldPreferFingerprint() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "000000").withFingerprint("GFA00"),
                    FeedSlot.loaded(1, "PLA", "000000").withFingerprint("GFA01"),
                    FeedSlot.loaded(2, "PLA", "000000").withFingerprint("GFA02")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#000000").withFingerprint("GFA01")), status);

            // Then
            assertThat(result).containsExactly(1);
        }

        @Test
        @DisplayName("Should pick the fourth of four identical black PLA spools by fingerprint")
        void shouldPickFourthIdenticalSpool() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "000000FF").withFingerprint("GFA00"),
                    FeedSlot.loaded(1, "PLA", "000000FF").withFingerprint("GFA01"),
                    FeedSlot.loaded(2, "PLA", "000000FF").withFingerprint("GFA02"),
                    FeedSlot.loaded(3, "PLA", "000000FF").withFingerprint("GFA03")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#000000").withFingerprint("GFA03")), status);

            // Then
            assertThat(result).containsExactly(3);
        }

        @Test
        @DisplayName("Should require equal material for a fingerprint match")
        void shouldRequireMaterialForFingerprint() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PETG", "FF0000").withFingerprint("P4d64437"),
                    FeedSlot.loaded(1, "PLA", "FF0000")));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(
                    List.of(req(1, "PLA", "#FF0000").withFingerprint("P4d64437")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).globalSlotId()).isEqualTo(1);
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.COLOR);
        }

        @Test
        @DisplayName("Should use color among several spools sharing a fingerprint")
        void shouldUseColorAmongSharedFingerprints() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "FFFFFF").withFingerprint("GFA00"),
                    FeedSlot.loaded(1, "PLA", "00AE42").withFingerprint("GFA00")));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(
                    List.of(req(1, "PLA", "#00AE42").withFingerprint("GFA00")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).globalSlotId()).isEqualTo(1);
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.FINGERPRINT);
        }

        @Test
        @DisplayName("Should fall back to color match when the fingerprint is not loaded")
        void shouldFallBackToColorWhenFingerprintMissing() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "FF0000").withFingerprint("GFA00"),
                    FeedSlot.loaded(1, "PLA", "000000").withFingerprint("GFA01")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#000000").withFingerprint("GFA99")), status);

            // Then
            assertThat(result).containsExactly(1);
        }

        @Test
        @DisplayName("Should prefer exact color over an earlier type-only candidate")
        void shouldPreferColorOverTypeOnly() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "FF0000"),
                    FeedSlot.loaded(1, "PLA", "00FF00")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#00FF00")), status);

            // Then
            assertThat(result).containsExactly(1);
        }

        @Test
        @DisplayName("Should prefer a similar color over a distant one")
        void shouldPreferSimilarColor() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "0000FF"),
                    FeedSlot.loaded(1, "PLA", "101010")));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(List.of(req(1, "PLA", "#000000")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).globalSlotId()).isEqualTo(1);
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.SIMILAR_COLOR);
        }

        @Test
        @DisplayName("Should skip the similar color tier when tolerance is zero")
        void shouldSkipSimilarTierWithZeroTolerance() {
            // Given
            RequirementMatcher strict = new RequirementMatcher(new InventoryNormalizer(), 0);
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "0000FF"),
                    FeedSlot.loaded(1, "PLA", "101010")));

            // When
            List<Integer> result = mapping(strict, List.of(req(1, "PLA", "#000000")), status);

            // Then
            assertThat(result).containsExactly(0);
        }

        @Test
        @DisplayName("Should accept a type-only match when no color matches")
        void shouldAcceptTypeOnly() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000")));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(List.of(req(1, "PLA", "#0000FF")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).globalSlotId()).isEqualTo(0);
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.TYPE_ONLY);
        }

        @Test
        @DisplayName("Should compare material case-insensitively and ignore alpha and '#' in colors")
        void shouldNormalizeTypeAndColor() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "pla", "FF0000FF")));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(List.of(req(1, "PLA", "#ff0000")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.COLOR);
        }

        @Test
        @DisplayName("Should never treat a missing color as a color match")
        void shouldNotMatchMissingColor() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "PLA", null)));

            // When
            List<MatchOutcome> outcomes = matcher.resolve(List.of(req(1, "PLA", "")),
                    matcher.getNormalizer().normalize(status));

            // Then
            assertThat(outcomes.get(0).globalSlotId()).isEqualTo(0);
            assertThat(outcomes.get(0).tier()).isEqualTo(EMatchTier.TYPE_ONLY);
        }
    }

    @Nested
    @DisplayName("Consumption and ordering")
    class Consumption {

        @Test
        @DisplayName("Should not hand the same slot to two identical requirements")
        void shouldNotReuseSlot() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#FF0000"), req(2, "PLA", "#FF0000")), status);

            // Then
            assertThat(result).containsExactly(0, -1);
        }

        @Test
        @DisplayName("Should leave other requirements unaffected when a material is missing")
        void shouldIsolateMissingMaterial() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "FF0000"),
                    FeedSlot.loaded(1, "PETG", "00FF00")));

            // When
            List<Integer> result = mapping(List.of(
                    req(1, "PLA", "#FF0000"),
                    req(2, "TPU", "#000000"),
                    req(3, "PETG", "#00FF00")), status);

            // Then
            assertThat(result).containsExactly(0, -1, 1);
        }

        @Test
        @DisplayName("Should give the first requirement first pick")
        void shouldResolveGreedilyInOrder() {
            // Given: the first requirement takes the only red slot even though the second needs it more
            Optional<FeedSnapshot> status = units(FeedUnit.of(0,
                    FeedSlot.loaded(0, "PLA", "FF0000"),
                    FeedSlot.loaded(1, "PLA", "0000FF")));

            // When
            List<Integer> result = mapping(List.of(req(1, "PLA", "#00FF00"), req(2, "PLA", "#FF0000")), status);

            // Then
            assertThat(result).containsExactly(0, 1);
        }

        @Test
        @DisplayName("Should return one distinct entry per requirement in requirement order")
        void shouldKeepLengthOrderAndUniqueness() {
            // Given
            Optional<FeedSnapshot> status = Optional.of(FeedSnapshot.of(List.of(
                    FeedUnit.of(0,
                            FeedSlot.loaded(0, "PLA", "000000"),
                            FeedSlot.loaded(1, "PLA", "FFFFFF"),
                            FeedSlot.loaded(2, "PETG", "FF0000"),
                            FeedSlot.empty(3)),
                    FeedUnit.of(1,
                            FeedSlot.loaded(0, "PLA", "000000"),
                            FeedSlot.loaded(1, "ABS", "FFFFFF"))))
                    .withExternals(new ExternalFeed(254, FeedSlot.external("PLA", "00FF00"))));
            List<FilamentRequirement> reqs = List.of(
                    req(1, "PLA", "#000000"),
                    req(2, "PLA", "#000000"),
                    req(3, "PLA", "#000000"),
                    req(4, "PLA", "#000000"),
                    req(5, "PLA", "#000000"),
                    req(6, "ABS", "#FFFFFF"),
                    req(7, "PETG", "#FF0000"));

            // When
            List<Integer> result = mapping(reqs, status);

            // Then
            assertThat(result).hasSize(reqs.size());
            assertThat(result).containsExactly(0, 4, 1, 254, -1, 5, 2);
            List<Integer> assigned = result.stream().filter(id -> id != MappingResult.UNMATCHED).collect(Collectors.toList());
            assertThat(assigned).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Slot identifiers")
    class SlotIds {

        @Test
        @DisplayName("Should compute unit * 4 + slot for regular units")
        void shouldUseRegularFormula() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(1,
                    FeedSlot.empty(0), FeedSlot.empty(1), FeedSlot.loaded(2, "PLA", "FF0000"), FeedSlot.empty(3)));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000")), status)).containsExactly(6);
        }

        @Test
        @DisplayName("Should map to the external holder as 254 regardless of unit numbers")
        void shouldUseFixedExternalId() {
            // Given
            Optional<FeedSnapshot> status = Optional.of(FeedSnapshot.of(List.of(
                            FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000")),
                            FeedUnit.of(3, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1))))
                    .withExternals(new ExternalFeed(254, FeedSlot.external("TPU", "0000FF"))));

            // When & Then
            assertThat(mapping(List.of(req(1, "TPU", "#0000FF")), status)).containsExactly(254);
        }

        @Test
        @DisplayName("Should map a high-throughput unit using the configured convention")
        void shouldHonourHtConvention() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(128, FeedSlot.loaded(0, "PLA-CF", "000000")));
            RequirementMatcher formula = new RequirementMatcher(new InventoryNormalizer(EHtSlotIdConvention.SLOT_FORMULA), 40);
            List<FilamentRequirement> reqs = List.of(req(1, "PLA-CF", "#000000"));

            // When & Then
            assertThat(mapping(reqs, status)).containsExactly(128);
            assertThat(mapping(formula, reqs, status)).containsExactly(512);
        }
    }

    @Nested
    @DisplayName("Extruder constraint")
    class Extruders {

        private final ExtruderTopology topology = new ExtruderTopology(Map.of(0, 1, 1, 0));

        private Optional<FeedSnapshot> dual(FeedUnit... units) {
            return Optional.of(FeedSnapshot.of(List.of(units)).withTopology(topology));
        }

        @Test
        @DisplayName("Should restrict candidates to the target extruder")
        void shouldFilterByExtruder() {
            // Given
            Optional<FeedSnapshot> status = dual(
                    FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000")),
                    FeedUnit.of(1, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1)));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000").onExtruder(1)), status)).containsExactly(0);
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000").onExtruder(0)), status)).containsExactly(4);
        }

        @Test
        @DisplayName("Should not fall back to the other extruder when the target has no slots")
        void shouldNotFallBackWhenExtruderEmpty() {
            // Given
            Optional<FeedSnapshot> status = Optional.of(FeedSnapshot.of(List.of(
                            FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1))))
                    .withTopology(new ExtruderTopology(Map.of(0, 0))));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000").onExtruder(1)), status)).containsExactly(-1);
        }

        @Test
        @DisplayName("Should stay restricted when the target extruder only has other materials")
        void shouldStayRestrictedOnWrongMaterial() {
            // Given
            Optional<FeedSnapshot> status = dual(
                    FeedUnit.of(0, FeedSlot.loaded(0, "PETG", "FF0000"), FeedSlot.empty(1)),
                    FeedUnit.of(1, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1)));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000").onExtruder(1)), status)).containsExactly(-1);
        }

        @Test
        @DisplayName("Should search every extruder when the requirement has no target")
        void shouldSkipFilterWithoutTarget() {
            // Given
            Optional<FeedSnapshot> status = dual(
                    FeedUnit.of(0, FeedSlot.loaded(0, "PETG", "FF0000"), FeedSlot.empty(1)),
                    FeedUnit.of(1, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1)));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000")), status)).containsExactly(4);
        }

        @Test
        @DisplayName("Should pair each pinned requirement with its own extruder's slot")
        void shouldNotSwapPinnedRequirements() {
            // Given: identical spools on both extruders
            Optional<FeedSnapshot> status = dual(
                    FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "000000"), FeedSlot.empty(1)),
                    FeedUnit.of(1, FeedSlot.loaded(0, "PLA", "000000"), FeedSlot.empty(1)));

            // When
            List<Integer> result = mapping(List.of(
                    req(1, "PLA", "#000000").onExtruder(0),
                    req(2, "PLA", "#000000").onExtruder(1)), status);

            // Then
            assertThat(result).containsExactly(4, 0);
        }

        @Test
        @DisplayName("Should ignore the target extruder on single-extruder machines")
        void shouldIgnoreTargetWithoutTopology() {
            // Given
            Optional<FeedSnapshot> status = units(FeedUnit.of(0, FeedSlot.loaded(0, "PLA", "FF0000"), FeedSlot.empty(1)));

            // When & Then
            assertThat(mapping(List.of(req(1, "PLA", "#FF0000").onExtruder(1)), status)).containsExactly(0);
        }

        @Test
        @DisplayName("Should route external holders by position on dual-extruder machines")
        void shouldRouteExternalHoldersByPosition() {
            // Given
            Optional<FeedSnapshot> status = Optional.of(FeedSnapshot.of(List.of(
                            FeedUnit.of(0, FeedSlot.loaded(0, "PETG", "FFFFFF"), FeedSlot.empty(1))))
                    .withExternals(
                            new ExternalFeed(254, FeedSlot.external("TPU", "000000")),
                            new ExternalFeed(255, FeedSlot.external("TPU", "000000")))
                    .withTopology(topology));

            // When & Then
            assertThat(mapping(List.of(req(1, "TPU", "#000000").onExtruder(1)), status)).containsExactly(255);
        }
    }
}
