package com.fcube.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the FCube project configuration.
 * <p>
 * The file is optional. When it is missing, unreadable or malformed the
 * defaults of {@link FcubeConfig} apply, so a broken config never blocks a
 * command. {@code ${VAR}} and {@code ${VAR:-default}} references are
 * substituted from the environment before parsing.
 * </p>
 */
@Slf4j
public class ConfigService {

    public static final String CONFIG_FILENAME = "fcube.json";
    public static final String ENV_CONFIG_PATH = "FCUBE_CONFIG_PATH";
    public static final String ENV_APP_DIR = "FCUBE_APP_DIR";

    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, System.getenv());
    }

    public ConfigService(Path configPath, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Config service for a project root: {@code FCUBE_CONFIG_PATH} when set,
     * otherwise {@code <projectRoot>/fcube.json}.
     */
    public static ConfigService forProject(Path projectRoot, Map<String, String> env) {
        String override = trimToNull(env.get(ENV_CONFIG_PATH));
        Path path = override != null
                ? projectRoot.resolve(override)
                : projectRoot.resolve(CONFIG_FILENAME);
        return new ConfigService(path, env);
    }

    public FcubeConfig loadConfig() {
        FcubeConfig config;
        if (!Files.exists(configPath)) {
            log.debug("Config file not found: {}, using defaults", configPath);
            config = new FcubeConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, FcubeConfig.class);
                log.debug("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.warn("Failed to load config from {}: {}, using defaults", configPath, e.getMessage());
                config = new FcubeConfig();
            }
        }
        return applyDefaults(config);
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Replace {@code ${VAR}} and {@code ${VAR:-default}} with environment values.
     * Unset variables without a default are left untouched.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = env.get(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : matcher.group(0);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private FcubeConfig applyDefaults(FcubeConfig config) {
        String appDirOverride = trimToNull(env.get(ENV_APP_DIR));
        if (appDirOverride != null) {
            config.setAppDir(appDirOverride);
        } else if (trimToNull(config.getAppDir()) == null) {
            config.setAppDir(FcubeConfig.DEFAULT_APP_DIR);
        }
        if (config.getLock() == null) {
            config.setLock(new FcubeConfig.LockConfig());
        }
        if (config.getLock().getTimeoutMs() <= 0) {
            config.getLock().setTimeoutMs(FcubeConfig.LockConfig.DEFAULT_TIMEOUT_MS);
        }
        return config;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
