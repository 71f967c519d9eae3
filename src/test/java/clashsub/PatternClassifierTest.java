package clashsub;

import java.util.List;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternClassifierTest {

    @Test
    void activeRegions_shouldAlwaysContainCatchAll_evenWithoutNames() {
        List<RegionPattern> active = new PatternClassifier().activeRegions(List.of());

        assertThat(active).extracting(RegionPattern::label).containsExactly(PatternClassifier.CATCH_ALL_LABEL);
    }

    @Test
    void activeRegions_shouldFollowTableOrder_notInputOrder() {
        // Arrange
        List<String> names = List.of("美国 01", "JP Tokyo", "香港 02");

        // Act
        List<RegionPattern> active = new PatternClassifier().activeRegions(names);

        // Assert
        assertThat(active).extracting(RegionPattern::label)
            .containsExactly("香港负载组", "日本负载组", "美国负载组", PatternClassifier.CATCH_ALL_LABEL);
    }

    @Test
    void activeRegions_shouldMatchCaseInsensitively() {
        List<RegionPattern> active = new PatternClassifier().activeRegions(List.of("Hong Kong Premium"));

        assertThat(active).extracting(RegionPattern::label).contains("香港负载组");
    }

    @Test
    void activeRegions_shouldTreatMalformedPatternAsNoMatch() {
        // Arrange
        PatternClassifier classifier = new PatternClassifier(List.of(
            new RegionPattern("Broken", "(?i)hk(("),
            new RegionPattern("HK", "(?i)hk")
        ));

        // Act
        List<RegionPattern> active = classifier.activeRegions(List.of("HK-01"));

        // Assert
        assertThat(active).extracting(RegionPattern::label)
            .containsExactly("HK", PatternClassifier.CATCH_ALL_LABEL);
    }

    @Test
    void constructor_shouldAppendCatchAll_whenTableHasNone() {
        PatternClassifier classifier = new PatternClassifier(List.of(new RegionPattern("HK", "(?i)hk")));

        assertThat(classifier.regions()).extracting(RegionPattern::filter).containsExactly("(?i)hk", ".*");
    }

    @Test
    void constructor_shouldKeepExistingCatchAll() {
        PatternClassifier classifier = new PatternClassifier(List.of(
            new RegionPattern("HK", "(?i)hk"),
            new RegionPattern("Rest", ".*")
        ));

        assertThat(classifier.regions()).extracting(RegionPattern::label).containsExactly("HK", "Rest");
    }

    @Test
    void classify_shouldUseFirstMatchingRegion_andFallBackToCatchAll() {
        // Arrange
        List<ProxyNode> nodes = List.of(
            named("新加坡 SG 01"),
            named("HK to SG relay"),
            named("Iceland"),
            ProxyNode.of(JsonNodeFactory.instance.objectNode().put("type", "ss"))
        );

        // Act
        List<ClassifiedNode> result = new PatternClassifier().classify(nodes);

        // Assert
        assertThat(result).extracting(c -> c.classification().tag())
            .containsExactly("新加坡负载组", "香港负载组", PatternClassifier.CATCH_ALL_LABEL);
    }

    private static ProxyNode named(String name) {
        return ProxyNode.of(JsonNodeFactory.instance.objectNode().put("name", name));
    }
}
