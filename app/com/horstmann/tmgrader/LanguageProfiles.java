package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The table of known languages, in priority order.
 */
public class LanguageProfiles {
    private final List<LanguageProfile> profiles;

    public LanguageProfiles(List<LanguageProfile> profiles) {
        this.profiles = List.copyOf(profiles);
    }

    public List<LanguageProfile> getProfiles() {
        return profiles;
    }

    public LanguageProfile get(String id) {
        for (LanguageProfile profile : profiles)
            if (profile.getId().equals(id)) return profile;
        return null;
    }

    /**
     * @return the first profile whose source extension matches, or null
     */
    public LanguageProfile profileFor(Path file) {
        for (LanguageProfile profile : profiles)
            if (profile.isSource(file)) return profile;
        return null;
    }

    public List<Path> sourceFiles(Collection<Path> files) {
        List<Path> result = new ArrayList<>();
        for (Path p : files)
            if (profileFor(p) != null) result.add(p);
        return result;
    }
}
