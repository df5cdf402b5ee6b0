package org.muma.minikv.command;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.minikv.config.MiniKvConfig;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisInteger;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;
import org.muma.minikv.rdb.RdbSaver;
import org.muma.minikv.replication.MasterLink;
import org.muma.minikv.replication.ReplicationManager;
import org.muma.minikv.replication.ReplicationMetadata;
import org.muma.minikv.replication.ServerRole;
import org.muma.minikv.server.RedisContext;
import org.muma.minikv.server.RedisCoreExecutor;
import org.muma.minikv.store.StorageEngine;
import org.muma.minikv.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandDispatcherTest {

    private static final long NOW = 1_700_000_000_000L;

    private StorageEngine storage;
    private MiniKvConfig config;
    private ReplicationManager replication;
    private CommandDispatcher dispatcher;
    private ServerRole master;
    private ChannelHandlerContext ctx;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        config = new MiniKvConfig();
        config.setDir("/tmp/minikv");
        config.setDbFilename("test.rdb");
        replication = new ReplicationManager(config, storage, mock(RedisCoreExecutor.class),
                new ReplicationMetadata(), new RdbSaver());
        dispatcher = new CommandDispatcher(storage, config, replication);
        master = new ServerRole.Master(replication);

        ctx = mock(ChannelHandlerContext.class);
        when(ctx.channel()).thenReturn(mock(Channel.class));
    }

    private CommandResult exec(long now, String... args) {
        return dispatcher.dispatch(args[0], RedisArray.of(args), RedisContext.client(ctx, now, master));
    }

    private CommandResult exec(String... args) {
        return exec(NOW, args);
    }

    private static String str(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof ErrorMessage e) return e.content();
        return null;
    }

    private static Set<String> bulkSet(RedisMessage msg) {
        Set<String> result = new HashSet<>();
        for (RedisMessage e : ((RedisArray) msg).elements()) {
            result.add(((BulkString) e).asString());
        }
        return result;
    }

    // --- 基础命令 ---

    @Test
    void testPingAndEcho() {
        assertEquals(new SimpleString("PONG"), exec("PING").reply());
        assertEquals(new BulkString("hi"), exec("PING", "hi").reply());
        assertInstanceOf(ErrorMessage.class, exec("PING", "a", "b").reply());
        assertEquals(new BulkString("hello world"), exec("ECHO", "hello world").reply());
        assertFalse(exec("PING").shouldPropagate());
    }

    @Test
    void testCommandNameIsCaseInsensitive() {
        assertEquals(new SimpleString("OK"), exec("set", "k", "v").reply());
        assertEquals(new BulkString("v"), exec("gEt", "k").reply());
    }

    @Test
    void testSetGetWithoutExpiry() {
        exec("SET", "k", "v");
        // 任意延迟后仍然可读
        assertEquals("v", str(exec(NOW + 365L * 24 * 3600 * 1000, "GET", "k").reply()));
    }

    @Test
    void testSetPxZeroIsImmediatelyExpired() {
        assertEquals(new SimpleString("OK"), exec("SET", "k", "v", "PX", "0").reply());
        assertTrue(((BulkString) exec("GET", "k").reply()).isNull());
    }

    @Test
    void testSetWithExAndPx() {
        exec("SET", "a", "1", "EX", "10");
        exec("SET", "b", "2", "px", "500");

        assertEquals("1", str(exec(NOW + 9_999, "GET", "a").reply()));
        assertTrue(((BulkString) exec(NOW + 10_000, "GET", "a").reply()).isNull());
        assertEquals("2", str(exec(NOW + 499, "GET", "b").reply()));
        assertTrue(((BulkString) exec(NOW + 500, "GET", "b").reply()).isNull());
    }

    // --- KEYS ---

    @Test
    void testKeysExcludesExpired() {
        exec("SET", "a", "1");
        exec("SET", "b", "2", "PX", "10");

        RedisMessage reply = exec(NOW + 10, "KEYS", "*").reply();
        assertEquals(Set.of("a"), bulkSet(reply));
    }

    @Test
    void testKeysWithPattern() {
        exec("SET", "user:1", "a");
        exec("SET", "user:2", "b");
        exec("SET", "order:1", "c");

        assertEquals(Set.of("user:1", "user:2"), bulkSet(exec("KEYS", "user:*").reply()));
        assertEquals(0, ((RedisArray) exec("KEYS", "none*").reply()).size());
    }

    // --- DEL ---

    @Test
    void testDelLiveKey() {
        exec("SET", "k", "v");
        CommandResult result = exec("DEL", "k");
        assertEquals(new RedisInteger(1), result.reply());
        assertTrue(result.shouldPropagate());
        assertTrue(((BulkString) exec("GET", "k").reply()).isNull());
    }

    @Test
    void testDelExpiredKeyCountsZero() {
        exec("SET", "k", "v", "PX", "5");
        CommandResult result = exec(NOW + 5, "DEL", "k");
        assertEquals(new RedisInteger(0), result.reply());
        assertFalse(result.shouldPropagate());
        assertEquals(0, storage.size());
    }

    @Test
    void testDelMultipleKeys() {
        exec("SET", "a", "1");
        exec("SET", "b", "2");
        assertEquals(new RedisInteger(2), exec("DEL", "a", "b", "missing").reply());
    }

    // --- 参数个数与未知命令 ---

    @Test
    void testWrongArityDoesNotTouchStore() {
        exec("SET", "k", "v");

        CommandResult noArgs = exec("GET");
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'get' command"), noArgs.reply());
        assertInstanceOf(ErrorMessage.class, exec("GET", "k", "extra").reply());

        CommandResult badSet = exec("SET", "k");
        assertInstanceOf(ErrorMessage.class, badSet.reply());
        assertFalse(badSet.shouldPropagate());

        assertEquals("v", str(exec("GET", "k").reply()));
        assertEquals(1, storage.size());
    }

    @Test
    void testUnknownCommand() {
        CommandResult result = exec("FLUSHEVERYTHING", "now");
        assertEquals(new ErrorMessage("ERR unknown command 'FLUSHEVERYTHING'"), result.reply());
        assertFalse(result.shouldPropagate());

        // 命令名里的 CR/LF 不能进入单行错误回复
        assertEquals(new ErrorMessage("ERR unknown command 'A  B'"), exec("A\r\nB").reply());
    }

    @Test
    void testSetOptionErrors() {
        assertEquals(new ErrorMessage("ERR value is not an integer or out of range"),
                exec("SET", "k", "v", "EX", "ten").reply());
        assertEquals(new ErrorMessage("ERR invalid expire time in 'set' command"),
                exec("SET", "k", "v", "PX", "-1").reply());
        assertEquals(new ErrorMessage("ERR syntax error"), exec("SET", "k", "v", "KEEPALL").reply());
        assertEquals(new ErrorMessage("ERR syntax error"), exec("SET", "k", "v", "EX").reply());
        assertEquals(0, storage.size());
    }

    @Test
    void testSetExpireOverflowIsRejected() {
        ErrorMessage expected = new ErrorMessage("ERR invalid expire time in 'set' command");
        for (String[] opts : new String[][]{
                {"EX", "9223372036854775807"},
                {"PX", "9223372036854775807"},
                {"EX", "9223372036854776"}}) {
            CommandResult result = exec("SET", "k", "v", opts[0], opts[1]);
            assertEquals(expected, result.reply());
            // 不写入，不传播
            assertFalse(result.shouldPropagate());
            assertTrue(((BulkString) exec("GET", "k").reply()).isNull());
        }
        assertEquals(0, storage.size());

        // 不溢出的大值仍然正常写入
        exec("SET", "k", "v", "EX", "100000000");
        assertEquals("v", str(exec("GET", "k").reply()));
    }

    // --- 传播 ---

    @Test
    void testSetPropagatesCanonicalCommand() {
        CommandResult result = exec("SET", "x", "1");
        assertTrue(result.shouldPropagate());
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\nx\r\n$1\r\n1\r\n",
                new String(result.propagation(), StandardCharsets.UTF_8));
    }

    @Test
    void testReadCommandsDoNotPropagate() {
        exec("SET", "x", "1");
        assertFalse(exec("GET", "x").shouldPropagate());
        assertFalse(exec("KEYS", "*").shouldPropagate());
        assertFalse(exec("ECHO", "x").shouldPropagate());
    }

    @Test
    void testSetNxFailureDoesNotPropagate() {
        exec("SET", "k", "v");
        CommandResult result = exec("SET", "k", "other", "NX");
        assertTrue(((BulkString) result.reply()).isNull());
        assertFalse(result.shouldPropagate());
        assertEquals("v", str(exec("GET", "k").reply()));
    }

    // --- CONFIG / INFO ---

    @Test
    void testConfigGet() {
        RedisArray dir = (RedisArray) exec("CONFIG", "GET", "dir").reply();
        assertEquals(RedisArray.of("dir", "/tmp/minikv"), dir);

        RedisArray file = (RedisArray) exec("config", "get", "dbfilename").reply();
        assertEquals(RedisArray.of("dbfilename", "test.rdb"), file);

        assertEquals(RedisArray.EMPTY, exec("CONFIG", "GET", "no-such-param").reply());
        assertEquals(new ErrorMessage("ERR unknown subcommand 'SET'"),
                exec("CONFIG", "SET", "dir", "/").reply());
    }

    @Test
    void testInfoReplicationOnMaster() {
        String info = str(exec("INFO", "replication").reply());
        assertTrue(info.contains("role:master"));
        assertTrue(info.contains("connected_slaves:0"));
        assertTrue(info.contains("master_replid:" + replication.getMetadata().getReplId()));
        assertTrue(info.contains("master_repl_offset:0"));
    }

    // --- Slave 只读 ---

    @Test
    void testReplicaRejectsClientWrites() {
        MasterLink link = mock(MasterLink.class);
        ServerRole replica = new ServerRole.Replica(link);

        CommandResult result = dispatcher.dispatch("SET", RedisArray.of("SET", "k", "v"),
                RedisContext.client(ctx, NOW, replica));
        assertEquals(new ErrorMessage("READONLY You can't write against a read only replica."), result.reply());
        assertEquals(0, storage.size());

        // 读命令照常
        assertInstanceOf(BulkString.class, dispatcher.dispatch("GET", RedisArray.of("GET", "k"),
                RedisContext.client(ctx, NOW, replica)).reply());
    }

    @Test
    void testReplicaAppliesWritesFromMasterWithoutPropagating() {
        MasterLink link = mock(MasterLink.class);
        ServerRole replica = new ServerRole.Replica(link);

        CommandResult result = dispatcher.dispatch("SET", RedisArray.of("SET", "k", "v"),
                RedisContext.masterLink(NOW, replica));
        assertEquals(new SimpleString("OK"), result.reply());
        assertFalse(result.shouldPropagate());
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), storage.get("k", NOW).getValue());
    }

    @Test
    void testPsyncOnReplicaIsRejected() {
        ServerRole replica = new ServerRole.Replica(mock(MasterLink.class));
        CommandResult result = dispatcher.dispatch("PSYNC", RedisArray.of("PSYNC", "?", "-1"),
                RedisContext.client(ctx, NOW, replica));
        assertEquals(new ErrorMessage("ERR PSYNC not supported on a replica"), result.reply());
    }

    @Test
    void testArgumentsArePassedThroughUnchanged() {
        exec("SET", "bin", "a b\r\nc");
        assertEquals("a b\r\nc", str(exec("GET", "bin").reply()));
        assertTrue(Arrays.equals("a b\r\nc".getBytes(StandardCharsets.UTF_8),
                ((BulkString) exec("GET", "bin").reply()).content()));
    }
}
