package org.muma.minikv.command;

import org.muma.minikv.command.impl.connection.EchoCommand;
import org.muma.minikv.command.impl.connection.PingCommand;
import org.muma.minikv.command.impl.key.DelCommand;
import org.muma.minikv.command.impl.key.KeysCommand;
import org.muma.minikv.command.impl.replication.PsyncCommand;
import org.muma.minikv.command.impl.replication.ReplConfCommand;
import org.muma.minikv.command.impl.server.ConfigCommand;
import org.muma.minikv.command.impl.server.InfoCommand;
import org.muma.minikv.command.impl.string.GetCommand;
import org.muma.minikv.command.impl.string.SetCommand;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发：查表 -> 参数个数检查 -> 只读检查 -> 执行 -> 决定是否传播
 * <p>
 * 必须在 RedisCoreExecutor 线程中调用，执行与传播入队因此是一个原子步骤。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final String READONLY_ERROR = "READONLY You can't write against a read only replica.";

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage, MiniKvConfig config, ReplicationManager replication) {
        this.storage = storage;
        this.initCommandRegistry(config, replication);
    }

    /**
     * 初始化命令注册表，按类别注册
     */
    private void initCommandRegistry(MiniKvConfig config, ReplicationManager replication) {
        registerConnectionCommands();
        registerStringCommands();
        registerGenericCommands();
        registerServerCommands(config, replication);
        registerReplicationCommands(replication);

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerGenericCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("KEYS", new KeysCommand());
    }

    private void registerServerCommands(MiniKvConfig config, ReplicationManager replication) {
        commandMap.put("CONFIG", new ConfigCommand(config));
        commandMap.put("INFO", new InfoCommand(config, replication));
    }

    private void registerReplicationCommands(ReplicationManager replication) {
        commandMap.put("REPLCONF", new ReplConfCommand(replication));
        commandMap.put("PSYNC", new PsyncCommand(replication));
    }

    /**
     * 核心分发逻辑
     */
    public CommandResult dispatch(String commandName, RedisArray args, RedisContext context) {
        // 1. 查找命令
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return CommandResult.reply(ErrorMessage.sanitized("ERR unknown command '" + commandName + "'"));
        }

        // 2. 参数个数检查，失败时不执行、不传播
        if (!command.checkArity(args.size())) {
            return CommandResult.reply(command.errorArgs(commandName.toLowerCase(Locale.ROOT)));
        }

        // 3. Slave 只接受来自 Master 链路的写命令
        if (command.isWrite() && context.getRole().isReplica() && !context.isFromMaster()) {
            return CommandResult.reply(new ErrorMessage(READONLY_ERROR));
        }

        // 4. 执行并监控耗时
        long startTime = System.nanoTime();
        RedisMessage response;
        try {
            response = command.execute(storage, args, context);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数错误、类型转换错误)
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return CommandResult.reply(ErrorMessage.sanitized("ERR " + e.getMessage()));
        } catch (Exception e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", commandName, e);
            return CommandResult.reply(new ErrorMessage("ERR internal server error"));
        }

        // 记录慢日志 (比如超过 10ms)
        long duration = (System.nanoTime() - startTime) / 1000_000;
        if (duration > 10) {
            log.warn("Slow command detected: {} cost {}ms", commandName, duration);
        } else if (log.isDebugEnabled()) {
            log.debug("Command executed: {} cost {}ms", commandName, duration);
        }

        // 5. 只有 Master 传播，Slave 应用的命令不会再次传播
        byte[] propagation = null;
        if (!context.getRole().isReplica() && !context.isFromMaster() && command.shouldPropagate(response)) {
            propagation = RespCodecUtil.encodeCommand(args.elements());
        }
        return new CommandResult(response, propagation);
    }
}
