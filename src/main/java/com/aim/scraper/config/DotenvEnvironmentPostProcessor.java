package com.aim.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a <code>.env</code> file from the working directory so that
 * placeholders such as <code>${AIM_PAGE_URL}</code> in
 * <code>application.yml</code> resolve without exporting shell variables.
 * Registered in <code>META-INF/spring.factories</code>.
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String SOURCE_NAME = "dotenvProperties";

    private final String directory;

    public DotenvEnvironmentPostProcessor() {
        this("./");
    }

    DotenvEnvironmentPostProcessor(final String directory) {
        this.directory = directory;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        // only the file's own entries; system env is already a property source
        Map<String, Object> entries = new LinkedHashMap<>();
        for (DotenvEntry e : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            entries.put(e.getKey(), e.getValue());
        }
        if (!entries.isEmpty()) {
            env.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, entries));
        }
    }
}
