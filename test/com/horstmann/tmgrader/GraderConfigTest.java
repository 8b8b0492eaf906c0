package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.nio.file.Paths;

import org.junit.Test;

public class GraderConfigTest {
    @Test
    public void defaults() {
        GraderConfig config = GraderConfig.load();
        assertEquals(5000, config.getRunTimeoutMillis());
        assertEquals(65536, config.getMaxOutputBytes());
        assertEquals(256L * 1024 * 1024, config.getMemoryBytes());
        assertEquals(1_000_000, config.getMaxSteps());
        assertTrue(config.getWorkers() >= 1);
        assertEquals(6, config.getTests().size());
    }

    @Test
    public void overrides() {
        GraderConfig config = GraderConfig.withOverrides("sandbox.run-timeout = 250ms", "workers = 3");
        assertEquals(250, config.getRunTimeoutMillis());
        assertEquals(3, config.getWorkers());
    }

    @Test
    public void languagesAreData() {
        LanguageProfiles profiles = new LanguageProfiles(GraderConfig.load().getLanguages());
        for (String id : new String[] { "java", "python", "c", "cpp" })
            assertNotNull(id, profiles.get(id));
        assertEquals("cpp", profiles.profileFor(Paths.get("sim.cc")).getId());
        assertTrue(profiles.get("c").belongsTo(Paths.get("tape.h")));
        assertEquals(null, profiles.profileFor(Paths.get("tape.h")));
    }
}
