package com.example.mongoprofile;

import com.example.mongoprofile.config.InvalidOptionException;
import com.example.mongoprofile.config.ProfileMode;
import com.example.mongoprofile.config.ProfileOptions;
import com.example.mongoprofile.report.OutputFormat;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProfilerConfigTest
{
    @TempDir
    Path tempDir;

    private static Config withOverrides(String hocon)
    {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.parseResources("application.conf"))
                .resolve();
    }

    @Test
    public void testBundledDefaults()
    {
        ProfilerConfig config = new ProfilerConfig(withOverrides("current.environment = dev"), null, null);

        assertThat(config.getCurrentEnvironment()).isEqualTo("dev");
        assertThat(config.getMongoUrl()).isEqualTo("mongodb://localhost:27017");
        assertThat(config.getDatabaseName()).isEqualTo("realm");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.isWriteFieldCsv()).isFalse();

        ProfileOptions options = config.getOptions();
        assertThat(options.getMode()).isEqualTo(ProfileMode.FULL);
        assertThat(options.getRequiredThreshold()).isEqualTo(ProfileOptions.DEFAULT_REQUIRED_THRESHOLD);
        assertThat(options.getSampleLimit()).isNull();
        assertThat(options.getRegexRules()).isEmpty();
    }

    @Test
    public void testOverridesAndRegexRules()
    {
        Config raw = withOverrides(String.join("\n",
                "profile.mode = LINT",
                "profile.output-format = YAML",
                "profile.sample-limit = 1000",
                "profile.required-threshold = 0.95",
                "profile.regex-rules = [",
                "  { field = \"status.code\", regex = \"^[A-Z]{3}$\", note = \"ISO currency\" }",
                "  { field = \"email\", regex = \"@\" }",
                "]"));

        ProfilerConfig config = new ProfilerConfig(raw, "stage", "archive");
        ProfileOptions options = config.getOptions();

        assertThat(config.getCurrentEnvironment()).isEqualTo("stage");
        assertThat(config.getDatabaseName()).isEqualTo("archive");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.YAML);
        assertThat(options.getMode()).isEqualTo(ProfileMode.LINT);
        assertThat(options.getSampleLimit()).isEqualTo(1000);
        assertThat(options.getRequiredThreshold()).isEqualTo(0.95);
        assertThat(options.getRegexRules().keySet()).containsExactly("status.code", "email");
        assertThat(options.getRegexRules().get("status.code").getNote()).isEqualTo("ISO currency");
        assertThat(options.getRegexRules().get("email").getNote()).isNull();
    }

    @Test
    public void testWrongTypeIsReportedAgainstOption()
    {
        assertThatThrownBy(() -> new ProfilerConfig(withOverrides("profile.examples-per-issue = many"), null, null))
                .isInstanceOfSatisfying(InvalidOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("examplesPerIssue"));

        assertThatThrownBy(() -> new ProfilerConfig(withOverrides("profile.mode = EVERYTHING"), null, null))
                .isInstanceOfSatisfying(InvalidOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("mode"));
    }

    @Test
    public void testOutOfRangeValuesFailValidation()
    {
        assertThatThrownBy(() -> new ProfilerConfig(withOverrides("profile.rare-field-max-fraction = 0.95"), null, null))
                .isInstanceOfSatisfying(InvalidOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("rareFieldMaxFraction"));

        assertThatThrownBy(() -> new ProfilerConfig(withOverrides(
                "profile.regex-rules = [ { field = date, regex = \"[0-9\" } ]"), null, null))
                .isInstanceOfSatisfying(InvalidOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("regexRules.date"));
    }

    @Test
    public void testUnknownEnvironment()
    {
        assertThatThrownBy(() -> new ProfilerConfig(withOverrides(""), "nowhere", null))
                .isInstanceOfSatisfying(InvalidOptionException.class,
                        e -> assertThat(e.getOption()).isEqualTo("mongodb.url.nowhere"));
    }

    @Test
    public void testEnsureOutputDirectory()
    {
        Path target = tempDir.resolve("reports/profiles");
        ProfilerConfig config = new ProfilerConfig(
                withOverrides("output.directory = \"" + target.toString().replace("\\", "/") + "\""), null, null);

        assertThat(config.ensureOutputDirectory()).isEqualTo(target);
        assertThat(Files.isDirectory(target)).isTrue();
    }
}
