package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How to recognize, build and run programs in one language. Profiles are pure data,
 * loaded from the languages table of the configuration.
 */
public class LanguageProfile {
    private final String id;
    private final List<String> extensions;
    private final List<String> auxiliaryExtensions;
    private final String image;
    private final Pattern mainPattern;
    private final Pattern packagePattern;
    private final String buildTemplate;
    private final String runTemplate;

    public LanguageProfile(String id, List<String> extensions, List<String> auxiliaryExtensions, String image,
            String mainPattern, String packagePattern, String buildTemplate, String runTemplate) {
        this.id = id;
        this.extensions = List.copyOf(extensions);
        this.auxiliaryExtensions = List.copyOf(auxiliaryExtensions);
        this.image = image;
        this.mainPattern = mainPattern == null ? null : Pattern.compile(mainPattern, Pattern.MULTILINE);
        this.packagePattern = packagePattern == null ? null : Pattern.compile(packagePattern, Pattern.MULTILINE);
        this.buildTemplate = buildTemplate;
        this.runTemplate = runTemplate;
    }

    public String getId() { return id; }
    public String getImage() { return image; }

    /**
     * @return the build command template, or null for interpreted languages
     */
    public String getBuildTemplate() { return buildTemplate; }
    public String getRunTemplate() { return runTemplate; }

    /**
     * Tests if a file is a compilation unit in this language, i.e. one of the
     * files handed to the compiler.
     */
    public boolean isSource(Path p) {
        return extensions.contains(Util.extension(p));
    }

    /**
     * Tests if a file belongs to a program in this language. For C, header files
     * belong to the program but are not compiled on their own.
     */
    public boolean belongsTo(Path p) {
        return isSource(p) || auxiliaryExtensions.contains(Util.extension(p));
    }

    /**
     * Tests if a source file is an entry point, i.e. contains the main marker of
     * this language.
     * @return false if this language has no main marker
     */
    public boolean isMain(Path fileName, String contents) {
        if (!isSource(fileName) || mainPattern == null || contents == null) return false;
        return mainPattern.matcher(contents).find();
    }

    /**
     * Derives the name under which the entry point is launched. For Java, the file
     * foo/Bar.java declaring package foo yields foo.Bar. Without a package pattern,
     * this is the file stem.
     */
    public String moduleOf(Path path, String contents) {
        String stem = Util.stem(path);
        if (packagePattern == null || contents == null) return stem;
        Matcher matcher = packagePattern.matcher(contents);
        if (matcher.find()) return matcher.group("pkg") + "." + stem;
        return stem;
    }

    /**
     * Replaces every {name} in a command template by its value.
     */
    public static String expand(String template, Map<String, String> variables) {
        if (template == null) return null;
        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            int end = template.indexOf('}', i);
            if (c == '{' && end > i) {
                String name = template.substring(i + 1, end);
                if (variables.containsKey(name)) {
                    result.append(variables.get(name));
                    i = end + 1;
                    continue;
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return id;
    }
}
