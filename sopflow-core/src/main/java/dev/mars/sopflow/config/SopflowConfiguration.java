package dev.mars.sopflow.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the procedure compiler: canvas layout constants, the reserved
 * metadata key and document defaults.
 *
 * <p>Sources are applied in order: built-in defaults, the first readable
 * {@code sopflow.properties} file (working directory, {@code config/}, {@code ~/.sopflow/}),
 * the classpath, and finally {@code sopflow.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SopflowConfiguration {
    private static final Logger logger = Logger.getLogger(SopflowConfiguration.class.getName());

    public static final String LAYOUT_X_START = "sopflow.layout.x.start";
    public static final String LAYOUT_X_SPACING = "sopflow.layout.x.spacing";
    public static final String LAYOUT_Y_START = "sopflow.layout.y.start";
    public static final String LAYOUT_Y_BRANCH_OFFSET = "sopflow.layout.y.branch.offset";
    public static final String METADATA_KEY = "sopflow.compiler.metadata.key";
    public static final String DEFAULT_DOCUMENT_VERSION = "sopflow.document.default.version";

    private static final int DEFAULT_X_START = 250;
    private static final int DEFAULT_X_SPACING = 300;
    private static final int DEFAULT_Y_START = 300;
    private static final int DEFAULT_BRANCH_OFFSET = 150;
    private static final String DEFAULT_METADATA_KEY = "_sopStep";
    private static final String DEFAULT_VERSION = "1.0.0";

    private final Properties properties;

    public SopflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public SopflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration holding only the built-in defaults.
     */
    public static SopflowConfiguration defaults() {
        return new SopflowConfiguration(null);
    }

    // Layout
    public int getXStart() {
        return getIntProperty(LAYOUT_X_START, DEFAULT_X_START);
    }

    public int getXSpacing() {
        return getIntProperty(LAYOUT_X_SPACING, DEFAULT_X_SPACING);
    }

    public int getYStart() {
        return getIntProperty(LAYOUT_Y_START, DEFAULT_Y_START);
    }

    public int getBranchOffset() {
        return getIntProperty(LAYOUT_Y_BRANCH_OFFSET, DEFAULT_BRANCH_OFFSET);
    }

    // Compiler
    public String getMetadataKey() {
        String key = properties.getProperty(METADATA_KEY);
        return key == null || key.isBlank() ? DEFAULT_METADATA_KEY : key.trim();
    }

    public String getDefaultDocumentVersion() {
        return properties.getProperty(DEFAULT_DOCUMENT_VERSION, DEFAULT_VERSION);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(LAYOUT_X_START, String.valueOf(DEFAULT_X_START));
        properties.setProperty(LAYOUT_X_SPACING, String.valueOf(DEFAULT_X_SPACING));
        properties.setProperty(LAYOUT_Y_START, String.valueOf(DEFAULT_Y_START));
        properties.setProperty(LAYOUT_Y_BRANCH_OFFSET, String.valueOf(DEFAULT_BRANCH_OFFSET));
        properties.setProperty(METADATA_KEY, DEFAULT_METADATA_KEY);
        properties.setProperty(DEFAULT_DOCUMENT_VERSION, DEFAULT_VERSION);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "sopflow.properties",
                "config/sopflow.properties",
                System.getProperty("user.home") + "/.sopflow/sopflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = SopflowConfiguration.class.getClassLoader().getResourceAsStream("sopflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("sopflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "SopflowConfiguration{" +
                "xStart=" + getXStart() +
                ", xSpacing=" + getXSpacing() +
                ", yStart=" + getYStart() +
                ", branchOffset=" + getBranchOffset() +
                ", metadataKey='" + getMetadataKey() + '\'' +
                '}';
    }
}
