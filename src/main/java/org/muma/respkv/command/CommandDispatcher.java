package org.muma.respkv.command;

import org.muma.respkv.command.impl.connection.EchoCommand;
import org.muma.respkv.command.impl.connection.PingCommand;
import org.muma.respkv.command.impl.string.GetCommand;
import org.muma.respkv.command.impl.string.SetCommand;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发器
 * <p>
 * 所有结果（包括错误）都以 RedisMessage 的形式返回，dispatch 不会向外抛异常，
 * 会话层只需要编码并写回。注册表在构造后只读，可被多个 IO 线程同时使用。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();

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

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisArray args) {
        if (args.size() == 0 || !(args.elements()[0] instanceof BulkString verb) || verb.isNull()) {
            return new ErrorMessage("ERR unknown command");
        }

        String commandName = verb.asString().toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(commandName);

        if (command == null) {
            log.debug("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command");
        }

        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args);

            long duration = (System.nanoTime() - startTime) / 1_000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }
            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误
            log.warn("Command execution failed (Client Error): {} - {}", commandName, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", commandName, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
