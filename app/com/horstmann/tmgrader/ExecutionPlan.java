package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A resolved program: language, files, entry point and the build/run command
 * templates to use. The templates still contain the directory variables, which
 * only the sandbox session can fill in.
 */
public class ExecutionPlan {
    private final LanguageProfile language;
    private final Path root;
    private final List<Path> sourceFiles;
    private final Path entrypoint;
    private final String module;
    private final String buildTemplate;
    private final String runTemplate;

    public ExecutionPlan(LanguageProfile language, Path root, List<Path> sourceFiles, Path entrypoint,
            String module, String buildTemplate, String runTemplate) {
        this.language = language;
        this.root = root;
        this.sourceFiles = List.copyOf(sourceFiles);
        this.entrypoint = entrypoint;
        this.module = module;
        this.buildTemplate = buildTemplate;
        this.runTemplate = runTemplate;
    }

    public LanguageProfile getLanguage() { return language; }
    public Path getRoot() { return root; }
    public List<Path> getSourceFiles() { return sourceFiles; }
    public Path getEntrypoint() { return entrypoint; }

    /**
     * @return the build template, or null if there is nothing to build
     */
    public String getBuildTemplate() { return buildTemplate; }
    public String getRunTemplate() { return runTemplate; }

    /**
     * Fills in the command variables.
     * @param code the directory holding the submission, as seen by the command
     * @param compiled a writable directory for build output
     * @param data the directory holding the test data
     */
    public Map<String, String> variables(String code, String compiled, String data) {
        Map<String, String> vars = new HashMap<>();
        vars.put("code", Util.shellQuote(code));
        vars.put("compiled", Util.shellQuote(compiled));
        vars.put("data", Util.shellQuote(data));
        StringBuilder sources = new StringBuilder();
        for (Path p : sourceFiles) {
            if (sources.length() > 0) sources.append(" ");
            sources.append(Util.shellQuote(p.toString().replace('\\', '/')));
        }
        vars.put("sources", sources.toString());
        vars.put("entrypoint", Util.shellQuote(entrypoint.toString().replace('\\', '/')));
        vars.put("stem", Util.shellQuote(Util.stem(entrypoint)));
        vars.put("class", Util.shellQuote(module));
        return vars;
    }

    public String toString() {
        return language + " program " + entrypoint + " in " + root;
    }
}
