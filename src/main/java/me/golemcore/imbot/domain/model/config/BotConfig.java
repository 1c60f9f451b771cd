package me.golemcore.imbot.domain.model.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.imbot.domain.model.Platform;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Configuration of a single bot instance, bound from {@code imbot.bots[n]}.
 *
 * <p>
 * Secret-like auth fields and string options may reference an environment
 * variable as {@code $NAME}; {@link #expandEnvVars(UnaryOperator)} resolves
 * them before the bot is created.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BotConfig {

    private Platform platform;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private AuthConfig auth = new AuthConfig();

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    @Builder.Default
    private LoggingConfig logging = new LoggingConfig();

    public void validate() {
        if (platform == null) {
            throw new IllegalArgumentException("invalid platform: " + platform);
        }
        if (auth == null) {
            throw new IllegalArgumentException("invalid auth config: auth is required");
        }
        try {
            auth.validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid auth config: " + e.getMessage(), e);
        }
    }

    /**
     * Returns a copy with {@code $NAME} references replaced through the given
     * resolver. Unset variables expand to an empty string.
     */
    public BotConfig expandEnvVars(UnaryOperator<String> resolver) {
        UnaryOperator<String> expander = value -> {
            if (value == null || value.length() < 2 || !value.startsWith("$")) {
                return value;
            }
            String resolved = resolver.apply(value.substring(1));
            return resolved != null ? resolved : "";
        };
        Map<String, Object> expandedOptions = new LinkedHashMap<>();
        if (options != null) {
            options.forEach((key, value) -> expandedOptions.put(key,
                    value instanceof String text ? expander.apply(text) : value));
        }
        return toBuilder()
                .auth(auth != null ? auth.expand(expander) : null)
                .options(expandedOptions)
                .logging(logging != null ? logging.toBuilder().build() : new LoggingConfig())
                .build();
    }

    public BotConfig expandEnvVars() {
        return expandEnvVars(System::getenv);
    }

    public String getOptionString(String key, String defaultValue) {
        Object value = option(key);
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString();
        return text.isEmpty() ? defaultValue : text;
    }

    public boolean getOptionBool(String key, boolean defaultValue) {
        Object value = option(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }

    public int getOptionInt(String key, int defaultValue) {
        Object value = option(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("option " + key + " is not a number: " + text, e);
            }
        }
        return defaultValue;
    }

    /**
     * Returns a list option given either as a list or as a comma separated
     * string.
     */
    public List<String> getOptionList(String key) {
        Object value = option(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value instanceof Map<?, ?> indexed) {
            // Spring binds YAML lists inside a Map<String, Object> as {"0": .., "1": ..}
            return indexed.values().stream().map(String::valueOf).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        return List.of();
    }

    private Object option(String key) {
        return options != null ? options.get(key) : null;
    }

    public static List<BotConfig> enabled(List<BotConfig> configs) {
        return configs.stream().filter(BotConfig::isEnabled).toList();
    }
}
