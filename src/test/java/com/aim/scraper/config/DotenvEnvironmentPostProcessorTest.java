package com.aim.scraper.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DotenvEnvironmentPostProcessorTest {

    @TempDir
    Path dir;

    @Test
    void fileEntriesBecomeFirstPropertySource() throws Exception {
        Files.writeString(dir.resolve(".env"), "AIM_PAGE_URL=http://localhost:9000/aim/model2/model2a.php\nAIM_TIMEOUT=5s\n");
        StandardEnvironment env = new StandardEnvironment();

        new DotenvEnvironmentPostProcessor(dir.toString()).postProcessEnvironment(env, new SpringApplication());

        assertEquals(DotenvEnvironmentPostProcessor.SOURCE_NAME, env.getPropertySources().iterator().next().getName());
        assertEquals("http://localhost:9000/aim/model2/model2a.php", env.getProperty("AIM_PAGE_URL"));
        assertEquals("5s", env.getProperty("AIM_TIMEOUT"));
    }

    @Test
    void missingFileLeavesEnvironmentUntouched() {
        StandardEnvironment env = new StandardEnvironment();

        new DotenvEnvironmentPostProcessor(dir.toString()).postProcessEnvironment(env, new SpringApplication());

        assertFalse(env.getPropertySources().contains(DotenvEnvironmentPostProcessor.SOURCE_NAME));
        assertTrue(env.getPropertySources().size() > 0);
    }
}
