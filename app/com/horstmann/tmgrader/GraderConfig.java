package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the tmgrader section of the configuration. Defaults live in
 * reference.conf.
 */
public class GraderConfig {
    private final Config config;

    public GraderConfig(Config config) {
        config.checkValid(ConfigFactory.defaultReference(), "tmgrader");
        this.config = config.getConfig("tmgrader");
    }

    public static GraderConfig load() {
        return new GraderConfig(ConfigFactory.load());
    }

    /**
     * Loads the defaults with some values replaced, e.g. "sandbox.run-timeout=1s".
     */
    public static GraderConfig withOverrides(String... settings) {
        Config overrides = ConfigFactory.parseString("tmgrader { " + String.join("\n", settings) + " }");
        return new GraderConfig(overrides.withFallback(ConfigFactory.load()).resolve());
    }

    public int getWorkers() {
        int workers = config.getInt("workers");
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public String getDockerHost() {
        return config.getString("sandbox.docker-host");
    }

    public int getBuildTimeoutMillis() {
        return (int) config.getDuration("sandbox.build-timeout", TimeUnit.MILLISECONDS);
    }

    public int getRunTimeoutMillis() {
        return (int) config.getDuration("sandbox.run-timeout", TimeUnit.MILLISECONDS);
    }

    public int getMaxOutputBytes() {
        return config.getInt("sandbox.max-output-bytes");
    }

    public long getMemoryBytes() {
        return config.getBytes("sandbox.memory");
    }

    public long getPidsLimit() {
        return config.getLong("sandbox.pids-limit");
    }

    public long getMaxSteps() {
        return config.getLong("simulation.max-steps");
    }

    public int getCycleHistory() {
        return config.getInt("simulation.cycle-history");
    }

    public int getCycleWindow() {
        return config.getInt("simulation.cycle-window");
    }

    public List<TestCase> getTests() {
        List<TestCase> tests = new ArrayList<>();
        for (Config test : config.getConfigList("tests"))
            tests.add(new TestCase(test.getString("machine"), test.getString("input")));
        return tests;
    }

    public List<LanguageProfile> getLanguages() {
        List<LanguageProfile> languages = new ArrayList<>();
        for (Config language : config.getConfigList("languages")) {
            languages.add(new LanguageProfile(
                language.getString("id"),
                language.getStringList("extensions"),
                language.hasPath("auxiliary-extensions") ? language.getStringList("auxiliary-extensions") : List.of(),
                language.getString("image"),
                optional(language, "main-pattern"),
                optional(language, "package-pattern"),
                optional(language, "build"),
                language.getString("run")));
        }
        return languages;
    }

    private static String optional(Config config, String key) {
        return config.hasPath(key) ? config.getString(key) : null;
    }
}
