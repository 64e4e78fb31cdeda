package dev.issuebench.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class BaseConfig {
    /** Sentinel used to set null in the env. Only used for testing. */
    static final String NULL_OVERRIDE = "ISSUEBENCH_NULL_SENTINEL_" + System.currentTimeMillis();

    protected final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    @SuppressWarnings("unchecked")
    protected <T> @Nonnull T getConfig(@Nonnull String settingName, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Objects.requireNonNull(
                getConfig(settingName, defaultValue, (Class<T>) defaultValue.getClass()));
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String settingName, @Nullable T defaultValue, @Nonnull Class<T> settingClass) {
        @Nullable String rawVal = getEnvValue(settingName);
        if (rawVal == null) {
            return defaultValue;
        } else {
            return cast(rawVal.trim(), settingName, settingClass);
        }
    }

    @SuppressWarnings("unchecked")
    protected <T> T cast(
            @Nonnull String value, @Nonnull String settingName, @Nonnull Class<T> clazz) {
        try {
            if (clazz.equals(String.class)) {
                return (T) value;
            } else if (List.of(Boolean.class, boolean.class).contains(clazz)) {
                return (T) Boolean.valueOf(value);
            } else if (List.of(Integer.class, int.class).contains(clazz)) {
                return (T) Integer.valueOf(value);
            } else if (List.of(Long.class, long.class).contains(clazz)) {
                return (T) Long.valueOf(value);
            } else if (List.of(Double.class, double.class).contains(clazz)) {
                return (T) Double.valueOf(value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "%s must be a %s, got '%s'"
                            .formatted(settingName, clazz.getSimpleName(), value),
                    e);
        }
        throw new IllegalArgumentException(
                "Unsupported setting class: %s -- please implement or use a different default"
                        .formatted(clazz));
    }

    protected @Nullable String getEnvValue(@Nonnull String settingName) {
        // first try the override map
        var settingValue = envOverrides.get(settingName);
        if (settingValue == null) {
            // then get it from the sysenv
            settingValue = System.getenv(settingName);
        }
        return NULL_OVERRIDE.equals(settingValue) ? null : settingValue;
    }
}
