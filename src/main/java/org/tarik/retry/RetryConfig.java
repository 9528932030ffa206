/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
 */

package org.tarik.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.controller.AuthMode;
import org.tarik.retry.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

public class RetryConfig {
    private static final Logger LOG = LoggerFactory.getLogger(RetryConfig.class);
    private static final String CONFIG_FILE = "config.properties";
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value, boolean isSecret) {
    }

    // -----------------------------------------------------
    // Retry Config
    private static final ConfigProperty<Integer> MAX_ATTEMPTS = loadPropertyAsInteger("retry.max.attempts",
            "RETRY_MAX_ATTEMPTS", "5", false);
    private static final ConfigProperty<Integer> INITIAL_DELAY_MILLIS = loadPropertyAsInteger(
            "retry.initial.delay.millis", "RETRY_INITIAL_DELAY_MILLIS", "5000", false);
    private static final ConfigProperty<Integer> MAX_DELAY_MILLIS = loadPropertyAsInteger("retry.max.delay.millis",
            "RETRY_MAX_DELAY_MILLIS", "30000", false);

    // Model Config
    private static final ConfigProperty<AuthMode> AUTH_MODE = loadProperty("auth.mode", "AUTH_MODE",
            "oauth-personal", AuthMode::fromValue, false);
    private static final ConfigProperty<String> MODEL_NAME = loadProperty("model.name", "MODEL_NAME",
            "gemini-2.5-pro", s -> s, false);
    private static final ConfigProperty<String> FALLBACK_MODEL_NAME = loadProperty("fallback.model.name",
            "FALLBACK_MODEL_NAME", "gemini-2.5-flash", s -> s, false);

    // Checkpoint Config
    private static final ConfigProperty<Path> CHECKPOINT_ROOT_DIR = loadProperty("checkpoint.root.dir",
            "CHECKPOINT_ROOT_DIR", Path.of(System.getProperty("user.home"), ".genai-retry", "tmp").toString(),
            Path::of, false);

    // -----------------------------------------------------
    // Retry Config
    public static int getMaxAttempts() {
        return MAX_ATTEMPTS.value();
    }

    public static int getInitialDelayMillis() {
        return INITIAL_DELAY_MILLIS.value();
    }

    public static int getMaxDelayMillis() {
        return MAX_DELAY_MILLIS.value();
    }

    // -----------------------------------------------------
    // Model Config
    public static AuthMode getAuthMode() {
        return AUTH_MODE.value();
    }

    public static String getModelName() {
        return MODEL_NAME.value();
    }

    public static String getFallbackModelName() {
        return FALLBACK_MODEL_NAME.value();
    }

    // -----------------------------------------------------
    // Checkpoint Config
    public static Path getCheckpointRootDir() {
        return CHECKPOINT_ROOT_DIR.value();
    }

    private static Properties loadConfigPropertiesFromFile() {
        try (InputStream inputStream = RetryConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            Properties properties = new Properties();
            if (inputStream == null) {
                LOG.error("Cannot find resource file '{}' in classpath.", CONFIG_FILE);
                throw new IOException("Cannot find resource: " + CONFIG_FILE);
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static <T> ConfigProperty<T> loadProperty(String key, String envVar, String defaultValue,
                                                      Function<String, T> converter, boolean isSecret) {
        var value = getProperty(key, envVar, defaultValue, isSecret);
        return new ConfigProperty<>(converter.apply(value), isSecret);
    }

    private static Optional<String> getProperty(String key, String envVar, boolean isSecret) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            var message = "Using environment variable '%s' for key '%s'".formatted(envVar, key);
            if (!isSecret) {
                message = "%s with value '%s'".formatted(message, envVariableOptional.get());
            }
            LOG.info(message);
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                var message = "Using property file value for key '%s'".formatted(key);
                if (!isSecret) {
                    message = "%s with value '%s'".formatted(message, propertyFileValueOptional.get());
                }
                LOG.info(message);
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue, boolean isSecret) {
        return getProperty(key, envVar, isSecret).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Integer> loadPropertyAsInteger(String propertyKey, String envVar, String defaultValue,
                                                                 boolean isSecret) {
        var configProperty = loadProperty(propertyKey, envVar, defaultValue, s -> s, isSecret);
        Integer value = CommonUtils.parseStringAsInteger(configProperty.value())
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct integer value:%s".formatted(propertyKey,
                                configProperty.value())));
        return new ConfigProperty<>(value, configProperty.isSecret());
    }
}
