package org.javai.recovery;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Resolves configuration from a system property, falling back to an environment variable.
 * Blank values count as unset.
 */
final class ConfigResolver {

    private final UnaryOperator<String> properties;
    private final UnaryOperator<String> environment;

    ConfigResolver(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    static ConfigResolver system() {
        return new ConfigResolver(System::getProperty, System::getenv);
    }

    Optional<String> resolve(String sysProp, String envVar) {
        String value = properties.apply(sysProp);
        if (value == null || value.isBlank()) {
            value = environment.apply(envVar);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    Optional<Boolean> resolveBoolean(String sysProp, String envVar) {
        return resolve(sysProp, envVar).map(value -> {
            if (value.equalsIgnoreCase("true")) {
                return Boolean.TRUE;
            }
            if (value.equalsIgnoreCase("false")) {
                return Boolean.FALSE;
            }
            throw invalid(sysProp, envVar, value, "expected true or false", null);
        });
    }

    Optional<Integer> resolveInt(String sysProp, String envVar) {
        return resolve(sysProp, envVar).map(value -> {
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                throw invalid(sysProp, envVar, value, "expected an integer", e);
            }
        });
    }

    Optional<Duration> resolveDuration(String sysProp, String envVar) {
        return resolve(sysProp, envVar).map(value -> {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw invalid(sysProp, envVar, value, "expected an ISO-8601 duration such as PT0.5S", e);
            }
        });
    }

    private static IllegalStateException invalid(String sysProp, String envVar, String value, String expectation, Throwable cause) {
        return new IllegalStateException(
                "Invalid configuration '" + value + "' for system property '" + sysProp +
                "' or environment variable '" + envVar + "': " + expectation,
                cause
        );
    }
}
