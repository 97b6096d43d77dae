package ai.romantext.harmony.config;

import java.util.Map;
import java.util.Optional;

/**
 * Reads settings from the process environment, snapshotted when the reader is created.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    private final Map<String, String> environment;

    public SystemEnvironmentReader() {
        this(System.getenv());
    }

    SystemEnvironmentReader(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key));
    }
}
