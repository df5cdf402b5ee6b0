package org.muma.minikv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * 服务配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 * <p>
 * 每个 Server 实例持有自己的配置对象，同一 JVM 内可以同时跑 Master 和 Slave。
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";

    // --- Core Settings ---
    private int port = 6379;

    // --- Snapshot (RDB) ---
    private String dir = ".";
    private String dbFilename = "dump.rdb";

    // --- Replication ---
    private String replicaOfHost = null;
    private int replicaOfPort = -1;

    // Master 向 Slave 发送 PING 的间隔 (秒)
    private int replPingReplicaPeriod = 10;
    // Slave 定时上报 ACK 的间隔 (秒)
    private int replAckPeriod = 1;
    // Slave 断线重连的退避时间 (毫秒)
    private long replReconnectBackoffMs = 1000;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    public void setReplicaOf(String host, int port) {
        this.replicaOfHost = host;
        this.replicaOfPort = port;
    }

    public File getSnapshotFile() {
        return new File(dir, dbFilename);
    }

    /**
     * 完整加载流程：先找 --config，再依次应用配置文件、环境变量、命令行参数
     */
    public static MiniKvConfig load(String[] args) {
        return load(args, System.getenv());
    }

    static MiniKvConfig load(String[] args, Map<String, String> env) {
        MiniKvConfig config = new MiniKvConfig();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.configFilePath = args[i + 1];
            }
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("MiniKvConfig initialized: {}", config);
        return config;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> i++; // 已在 load 中处理
                case "--port" -> this.port = parseInt("--port", requireValue(args, ++i, arg));
                case "--dir" -> this.dir = requireValue(args, ++i, arg);
                case "--dbfilename" -> this.dbFilename = requireValue(args, ++i, arg);
                case "--replicaof" -> {
                    // 两种写法: --replicaof "host port" 或 --replicaof host port
                    String value = requireValue(args, ++i, arg);
                    String[] parts = value.trim().split("\\s+");
                    if (parts.length == 2) {
                        setReplicaOf(parts[0], parseInt("--replicaof", parts[1]));
                    } else if (parts.length == 1) {
                        setReplicaOf(parts[0], parseInt("--replicaof", requireValue(args, ++i, arg)));
                    } else {
                        throw new IllegalArgumentException("Invalid --replicaof value: " + value);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        log.info("Config loaded from args: port={}, dir={}, dbfilename={}, replicaof={}",
                port, dir, dbFilename, isReplica() ? replicaOfHost + ":" + replicaOfPort : "none");
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = getInt(props, "port", this.port);
        this.dir = getString(props, "dir", this.dir);
        this.dbFilename = getString(props, "dbfilename", this.dbFilename);
        this.replPingReplicaPeriod = getInt(props, "repl-ping-replica-period", this.replPingReplicaPeriod);
        this.replAckPeriod = getInt(props, "repl-ack-period", this.replAckPeriod);
        this.replReconnectBackoffMs = getInt(props, "repl-reconnect-backoff", (int) this.replReconnectBackoffMs);

        // 格式: replicaof <host> <port> (中间用空格分隔)
        String replicaOf = getString(props, "replicaof", "");
        if (!replicaOf.isBlank()) {
            String[] parts = replicaOf.trim().split("\\s+");
            if (parts.length == 2) {
                setReplicaOf(parts[0], parseInt("replicaof", parts[1]));
            } else {
                log.warn("Invalid replicaof config format: {}", replicaOf);
            }
        }
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading config from classpath: {}", path, e);
        }
        // 尝试作为文件系统路径加载
        File file = new File(path);
        if (!file.isFile()) {
            log.debug("Config file not found: {}, using defaults.", path);
            return props;
        }
        try (InputStream fis = new FileInputStream(file)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file {} unreadable, using defaults.", path, e);
        }
        return props;
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt("MINIKV_PORT", envPort);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envDir = env.get("MINIKV_DIR");
        if (envDir != null) {
            this.dir = envDir;
            log.info("Dir overridden by ENV: {}", this.dir);
        }
    }

    /**
     * CONFIG GET 使用的只读查询，参数名大小写不敏感
     */
    public Optional<String> lookup(String param) {
        String value = switch (param.toLowerCase(Locale.ROOT)) {
            case "dir" -> dir;
            case "dbfilename" -> dbFilename;
            case "port" -> String.valueOf(port);
            case "replicaof" -> isReplica() ? replicaOfHost + " " + replicaOfPort : "";
            case "repl-ping-replica-period" -> String.valueOf(replPingReplicaPeriod);
            default -> null;
        };
        return Optional.ofNullable(value);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val) : defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", dir=" + dir + ", dbfilename=" + dbFilename
                + ", replicaof=" + (isReplica() ? replicaOfHost + ":" + replicaOfPort : "none") + "}";
    }
}
