package org.muma.minikv.server;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;
import org.muma.minikv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * 核心业务线程 (Single Thread Logic)
 * 所有的 Command.execute、快照加载/序列化、Slave 注册与命令传播都在这里排队执行。
 * 实现了无锁化：存储和 Slave 列表只会被这一个线程访问。
 */
public class RedisCoreExecutor {

    private static final Logger log = LoggerFactory.getLogger(RedisCoreExecutor.class);

    // 使用 Netty 的 DefaultEventExecutor，它是一个高效的单线程事件循环
    private final EventExecutor singleThread = new DefaultEventExecutor(ThreadUtils.namedThreadFactory("MiniKv-Core"));

    public Future<?> submit(Runnable task) {
        return singleThread.submit(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unexpected error in core thread", e);
            }
        });
    }

    public <T> Future<T> submit(Callable<T> task) {
        return singleThread.submit(task);
    }

    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelay, long period, TimeUnit unit) {
        return singleThread.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (Exception e) {
                // 周期任务抛异常会被取消，这里吃掉异常并记录
                log.error("Periodic task failed in core thread", e);
            }
        }, initialDelay, period, unit);
    }

    public boolean inCoreThread() {
        return singleThread.inEventLoop();
    }

    public void shutdown() {
        singleThread.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
