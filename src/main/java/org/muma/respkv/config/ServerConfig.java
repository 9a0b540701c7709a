package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 服务配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis.properties) > 默认值
 */
@Getter
@Setter
public class ServerConfig {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 6379;

    // --- Core Settings ---
    private int port = DEFAULT_PORT;
    private String bindAddress = "127.0.0.1";
    private int workerThreads = 0; // 0 = Netty default

    // --- Admission ---
    private int maxClients = 10000;
    private long permitTimeoutMillis = 5000;

    // --- Expiration ---
    private long evictionIntervalMillis = 100;

    // 请求非法时是否先回一个 RESP Error 再断开
    private boolean errorReplies = false;

    private String configFilePath = "redis.properties"; // 默认

    /**
     * 启动入口使用：先找 --config，再依次叠加配置文件、环境变量、命令行参数
     */
    public static ServerConfig load(String[] args) {
        ServerConfig config = new ServerConfig();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.configFilePath = args[i + 1];
            }
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides();
        config.parseArgs(args);
        config.validate();
        log.info("ServerConfig initialized: {}", config);
        return config;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> this.configFilePath = requireValue(args, i++);
                case "--port", "-p" -> this.port = parseIntArg(arg, requireValue(args, i++));
                case "--max-conn", "-m" -> this.maxClients = parseIntArg(arg, requireValue(args, i++));
                case "--bind" -> this.bindAddress = requireValue(args, i++);
                default -> log.warn("Ignoring unknown argument: {}", arg);
            }
        }
        log.debug("Config loaded from args: port={}, maxClients={}", port, maxClients);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.bindAddress = getString(props, "server.bind", this.bindAddress);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Admission
        this.maxClients = getInt(props, "server.max_clients", this.maxClients);
        this.permitTimeoutMillis = getLong(props, "server.permit_timeout_ms", this.permitTimeoutMillis);

        // 3. Expiration
        this.evictionIntervalMillis = getLong(props, "expire.sweep_interval_ms", this.evictionIntervalMillis);

        String replies = getString(props, "server.error_replies", errorReplies ? "yes" : "no");
        this.errorReplies = "yes".equalsIgnoreCase(replies);
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("worker threads must not be negative: " + workerThreads);
        }
        if (maxClients <= 0) {
            throw new IllegalArgumentException("max clients must be positive: " + maxClients);
        }
        if (permitTimeoutMillis <= 0) {
            throw new IllegalArgumentException("permit timeout must be positive: " + permitTimeoutMillis);
        }
        if (evictionIntervalMillis <= 0) {
            throw new IllegalArgumentException("eviction interval must be positive: " + evictionIntervalMillis);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envPort = System.getenv("REDIS_PORT");
        if (envPort != null) {
            this.port = parseIntArg("REDIS_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envMaxClients = System.getenv("REDIS_MAX_CLIENTS");
        if (envMaxClients != null) {
            this.maxClients = parseIntArg("REDIS_MAX_CLIENTS", envMaxClients);
            log.info("Max clients overridden by ENV: {}", this.maxClients);
        }
    }

    // 取出 flag 后面的值，flag 在末尾时报错
    private String requireValue(String[] args, int flagIndex) {
        if (flagIndex + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[flagIndex]);
        }
        return args[flagIndex + 1];
    }

    private int parseIntArg(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    // 配置文件里的坏值只告警，保留原值
    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue).trim();
    }

    @Override
    public String toString() {
        return "Config{bind=" + bindAddress + ":" + port + ", maxClients=" + maxClients
                + ", permitTimeout=" + permitTimeoutMillis + "ms, sweepInterval=" + evictionIntervalMillis + "ms}";
    }
}
