package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the language and the main file of a submitted program.
 */
public class EntrypointResolver {
    private static final Logger logger = LoggerFactory.getLogger(EntrypointResolver.class);
    private static final String[] NAME_HINTS = { "main", "sim", "program" };

    /**
     * Choices made by the operator for a single group. Any field may be null.
     */
    public static class Overrides {
        public final Path entrypoint;
        public final String buildCommand;
        public final String runCommand;

        public Overrides(Path entrypoint, String buildCommand, String runCommand) {
            this.entrypoint = entrypoint;
            this.buildCommand = buildCommand;
            this.runCommand = runCommand;
        }

        public static Overrides none() { return new Overrides(null, null, null); }

        public boolean isEmpty() {
            return entrypoint == null && buildCommand == null && runCommand == null;
        }
    }

    private final LanguageProfiles profiles;

    public EntrypointResolver(LanguageProfiles profiles) {
        this.profiles = profiles;
    }

    public Resolution resolve(SubmissionGroup group) {
        return resolve(group, Overrides.none());
    }

    public Resolution resolve(SubmissionGroup group, Overrides overrides) {
        List<Path> sources = profiles.sourceFiles(group.getFiles());
        if (sources.isEmpty()) {
            for (Path p : group.getFiles())
                for (LanguageProfile language : profiles.getProfiles())
                    if (language.belongsTo(p))
                        return Resolution.failed(Verdict.discoveryFailure(
                            "no recognized source files, only the " + language + " file " + p));
            return Resolution.failed(Verdict.discoveryFailure("no recognized source files"));
        }

        if (overrides.entrypoint != null) {
            if (!sources.contains(overrides.entrypoint))
                return Resolution.failed(Verdict.discoveryFailure("entrypoint " + overrides.entrypoint + " is not a source file"));
            return Resolution.of(plan(group, overrides.entrypoint, overrides));
        }

        List<Path> candidates = new ArrayList<>();
        for (Path p : sources) {
            LanguageProfile language = profiles.profileFor(p);
            if (language.isMain(p, Util.read(group.getRoot().resolve(p))))
                candidates.add(p);
        }
        if (candidates.size() == 1)
            return Resolution.of(plan(group, candidates.get(0), overrides));

        List<Path> pool = candidates.isEmpty() ? sources : candidates;
        Resolution result = byName(group, pool, overrides);
        if (result.isResolved() || overrides.runCommand == null) {
            if (!result.isResolved())
                logger.debug("Group {}: {}", group.getId(), result.getFailure());
            return result;
        }
        // A run command override makes the choice of entry point immaterial.
        Path chosen = firstOfMajorityLanguage(result.getFailure().getCandidates());
        logger.info("Group {}: using run command override with {}", group.getId(), chosen);
        return Resolution.of(plan(group, chosen, overrides));
    }

    private Resolution byName(SubmissionGroup group, List<Path> pool, Overrides overrides) {
        if (pool.size() == 1)
            return Resolution.of(plan(group, pool.get(0), overrides));
        for (String hint : NAME_HINTS) {
            List<Path> matches = new ArrayList<>();
            for (Path p : pool)
                if (Util.stem(p).toLowerCase().contains(hint)) matches.add(p);
            if (matches.size() == 1)
                return Resolution.of(plan(group, matches.get(0), overrides));
            if (matches.size() > 1)
                return Resolution.failed(Verdict.ambiguousEntrypoint(matches));
        }
        return Resolution.failed(Verdict.ambiguousEntrypoint(pool));
    }

    private Path firstOfMajorityLanguage(List<Path> candidates) {
        Map<LanguageProfile, List<Path>> byLanguage = new LinkedHashMap<>();
        for (Path p : candidates)
            byLanguage.computeIfAbsent(profiles.profileFor(p), k -> new ArrayList<>()).add(p);
        List<Path> best = null;
        for (List<Path> paths : byLanguage.values())
            if (best == null || paths.size() > best.size()) best = paths;
        return best.get(0);
    }

    private ExecutionPlan plan(SubmissionGroup group, Path entrypoint, Overrides overrides) {
        LanguageProfile language = profiles.profileFor(entrypoint);
        List<Path> languageSources = new ArrayList<>();
        for (Path p : group.getFiles())
            if (language.isSource(p)) languageSources.add(p);
        String module = language.moduleOf(entrypoint, Util.read(group.getRoot().resolve(entrypoint)));
        String build = overrides.buildCommand != null ? overrides.buildCommand : language.getBuildTemplate();
        String run = overrides.runCommand != null ? overrides.runCommand : language.getRunTemplate();
        return new ExecutionPlan(language, group.getRoot(), languageSources, entrypoint, module, build, run);
    }
}
