package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.replication.LeaderAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (respkv.properties) > 默认值
 */
@Getter
@Setter
public class ServerConfig {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "respkv.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int tcpBacklog = 511;
    // 客户端空闲超时（秒），0 表示不超时
    private int timeout = 0;
    private long protoMaxBulkLen = RespDecoder.DEFAULT_MAX_BULK_LENGTH;

    // --- Replication ---
    // 格式: "<host> <port>"，为空表示以 Master 身份运行
    private LeaderAddress replicaOf;
    // 握手每一步（含建连）的超时（秒）
    private int replTimeout = 60;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    public boolean isReplica() {
        return replicaOf != null;
    }

    public static ServerConfig load(String[] args) {
        return load(args, System::getenv);
    }

    static ServerConfig load(String[] args, Function<String, String> env) {
        ServerConfig config = new ServerConfig();
        config.configFilePath = findConfigPath(args);
        config.applyProperties(config.loadProperties(config.configFilePath));
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("ServerConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            if ("--config".equals(arg) && hasValue) {
                i++; // 已在 findConfigPath 中处理
            } else if ("--port".equals(arg) && hasValue) {
                this.port = parseInt("--port", args[++i], this.port);
            } else if ("--replicaof".equals(arg) && hasValue) {
                this.replicaOf = parseLeader(args[++i], this.replicaOf);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    void applyProperties(Properties props) {
        this.port = getInt(props, "port", this.port);
        this.workerThreads = getInt(props, "worker-threads", this.workerThreads);
        this.tcpBacklog = getInt(props, "tcp-backlog", this.tcpBacklog);
        this.timeout = getInt(props, "timeout", this.timeout);
        this.replTimeout = getInt(props, "repl-timeout", this.replTimeout);

        String maxBulk = props.getProperty("proto-max-bulk-len");
        if (maxBulk != null) {
            try {
                long size = parseSize(maxBulk);
                if (size < 1 || size > RespDecoder.MAX_ALLOWED_BULK_LENGTH) {
                    log.warn("proto-max-bulk-len '{}' out of range [1, {}], using {}.",
                            maxBulk, RespDecoder.MAX_ALLOWED_BULK_LENGTH, protoMaxBulkLen);
                } else {
                    this.protoMaxBulkLen = size;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid proto-max-bulk-len '{}', using default {}.", maxBulk, protoMaxBulkLen);
            }
        }

        String replicaof = props.getProperty("replicaof", "");
        if (!replicaof.isBlank()) {
            this.replicaOf = parseLeader(replicaof, this.replicaOf);
        }
    }

    private void applyEnvOverrides(Function<String, String> env) {
        String envPort = env.apply("RESPKV_PORT");
        if (envPort != null) {
            this.port = parseInt("RESPKV_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envReplicaOf = env.apply("RESPKV_REPLICAOF");
        if (envReplicaOf != null && !envReplicaOf.isBlank()) {
            this.replicaOf = parseLeader(envReplicaOf, this.replicaOf);
            log.info("Replicaof overridden by ENV: {}", this.replicaOf);
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
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

    private LeaderAddress parseLeader(String value, LeaderAddress fallback) {
        try {
            return LeaderAddress.parse(value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid replicaof value '{}': {}", value, e.getMessage());
            return fallback;
        }
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        return Long.parseLong(s.trim()) * multiplier;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val, defaultValue) : defaultValue;
    }

    private int parseInt(String key, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", key, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", replicaof=" + replicaOf + ", timeout=" + timeout
                + ", repl-timeout=" + replTimeout + "}";
    }
}
