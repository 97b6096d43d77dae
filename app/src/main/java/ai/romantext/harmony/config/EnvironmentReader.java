package ai.romantext.harmony.config;

import java.util.Optional;

/**
 * Source of {@code RNTXT_*} settings. Tests substitute a map-backed reader.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}; blank values count as unset.
     */
    default Optional<String> setting(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
