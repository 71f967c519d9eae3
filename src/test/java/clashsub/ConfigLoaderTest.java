package clashsub;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_shouldCompileEverySection() throws Exception {
        // Arrange
        String toml = "[server]\n"
            + "port = 9000\n"
            + "\n"
            + "[fetch]\n"
            + "connect_timeout_seconds = 5\n"
            + "user_agent = \"mihomo\"\n"
            + "forward_headers = [\"Subscription-Userinfo\"]\n"
            + "\n"
            + "[conversion]\n"
            + "policy = \"pattern\"\n"
            + "compaction = \"TEXT\"\n"
            + "\n"
            + "[probe]\n"
            + "interval = 300\n"
            + "\n"
            + "[settings]\n"
            + "mixed-port = 7893\n"
            + "\n"
            + "[regions]\n"
            + "\"香港负载组\" = \"(?i)港|hk\"\n"
            + "\"日本负载组\" = \"(?i)日|jp\"\n";

        // Act
        RuntimeConfig config = ConfigLoader.parse(toml);

        // Assert
        assertThat(config.port).isEqualTo(9000);
        assertThat(config.fetch.connectTimeout).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.fetch.requestTimeout).isEqualTo(Constants.REQUEST_TIMEOUT);
        assertThat(config.fetch.userAgent).isEqualTo("mihomo");
        assertThat(config.fetch.forwardHeaders).containsExactly("subscription-userinfo");

        ConverterOptions options = config.converter;
        assertThat(options.policy()).isEqualTo(GroupingPolicy.PATTERN);
        assertThat(options.compaction()).isEqualTo(CompactionMode.TEXT);
        assertThat(options.probe())
            .isEqualTo(new ProbePolicy(ProbePolicy.DEFAULT.url(), 300, ProbePolicy.DEFAULT.strategy()));
        assertThat(options.settingsOverride().get("mixed-port").asInt()).isEqualTo(7893);
        assertThat(options.regions()).containsExactly(
            new RegionPattern("香港负载组", "(?i)港|hk"),
            new RegionPattern("日本负载组", "(?i)日|jp"));
    }

    @Test
    void parse_shouldFallBackToDefaults_forMissingSections() throws Exception {
        // Act
        RuntimeConfig config = ConfigLoader.parse("[server]\nport = 8080\n");

        // Assert
        assertThat(config.port).isEqualTo(8080);
        assertThat(config.fetch.userAgent).isEqualTo("clash.meta");
        assertThat(config.fetch.forwardHeaders).containsExactlyElementsOf(Constants.FORWARDED_HEADERS);
        assertThat(config.converter.policy()).isEqualTo(GroupingPolicy.HEURISTIC);
        assertThat(config.converter.compaction()).isEqualTo(CompactionMode.NATIVE);
        assertThat(config.converter.probe()).isEqualTo(ProbePolicy.DEFAULT);
        assertThat(config.converter.regions()).isEqualTo(PatternClassifier.DEFAULT_REGIONS);
        assertThat(config.converter.settingsOverride().isEmpty()).isTrue();
    }

    @Test
    void parse_shouldReturnDefaults_forEmptyDocument() throws Exception {
        RuntimeConfig config = ConfigLoader.parse("");

        assertThat(config.port).isEqualTo(Constants.SERVER_PORT);
        assertThat(config.converter).isEqualTo(ConverterOptions.defaults());
    }

    @Test
    void parse_shouldRejectUnknownPolicy() {
        assertThatThrownBy(() -> ConfigLoader.parse("[conversion]\npolicy = \"smart\"\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("smart")
            .hasMessageContaining("heuristic");
    }

    @Test
    void parse_shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> ConfigLoader.parse("[server]\nport = 70000\n"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConfigLoader.parse("[fetch]\nrequest_timeout_seconds = 0\n"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConfigLoader.parse("[probe]\ninterval = \"often\"\n"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_shouldRejectSectionsOfTheWrongShape() {
        assertThatThrownBy(() -> ConfigLoader.parse("server = 8080\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("[server]");
        assertThatThrownBy(() -> ConfigLoader.parse("[regions]\n\"香港负载组\" = 1\n"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_shouldDropSettingsThatNameGeneratedSections() throws Exception {
        // Arrange
        String toml = "[settings]\n"
            + "rules = \"x\"\n"
            + "proxy-groups = []\n"
            + "\".lb_common\" = 1\n"
            + "mixed-port = 7893\n";

        // Act
        RuntimeConfig config = ConfigLoader.parse(toml);

        // Assert
        List<String> keys = new ArrayList<>();
        config.converter.settingsOverride().fieldNames().forEachRemaining(keys::add);
        assertThat(keys).containsExactly("mixed-port");
    }

    @Test
    void load_shouldUseDefaults_whenFileIsMissing() {
        RuntimeConfig config = ConfigLoader.load(tempDir.resolve("missing.toml").toString());

        assertThat(config).isNotNull();
        assertThat(config.port).isEqualTo(Constants.SERVER_PORT);
    }

    @Test
    void load_shouldReadConfigurationFile() throws Exception {
        // Arrange
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[conversion]\npolicy = \"pattern\"\n", StandardCharsets.UTF_8);

        // Act
        RuntimeConfig config = ConfigLoader.load(file.toString());

        // Assert
        assertThat(config.converter.policy()).isEqualTo(GroupingPolicy.PATTERN);
    }

    @Test
    void load_shouldReturnNull_whenFileIsInvalid() throws Exception {
        // Arrange
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[server\nport = ", StandardCharsets.UTF_8);

        // Act + Assert
        assertThat(ConfigLoader.load(file.toString())).isNull();
    }
}
