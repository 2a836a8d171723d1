package com.dlxretry.core.handler;

import com.dlxretry.core.spi.TaskHandler;
import com.dlxretry.model.Command;
import com.dlxretry.model.ctx.DeliveryContext;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 内置任务：把 Command 负载作为子进程执行
 * 退出码 0 为成功; stdout 按 INFO、stderr 按 WARN 逐行写入日志
 */
@Slf4j
public class CommandTaskHandler implements TaskHandler<Command>, AutoCloseable {

    private final String queue;

    /** 单条命令最长执行时间, 超时强杀子进程并按失败处理 */
    private final Duration timeout;

    /** 子进程输出泵 */
    private final ExecutorService pumps = Executors.newCachedThreadPool(new NamedThreadFactory("dlx-command-io"));

    public CommandTaskHandler(String queue, Duration timeout) {
        this.queue = queue;
        this.timeout = timeout;
    }

    @Override
    public boolean supports(String queue) {
        return this.queue.equals(queue);
    }

    @Override
    public TypeReference<Command> payloadType() {
        return new TypeReference<Command>() {};
    }

    @Override
    public boolean execute(DeliveryContext ctx, Command command) throws Exception {
        if (command == null || command.getCmd() == null || command.getCmd().isBlank()) {
            throw new IllegalArgumentException("command payload without cmd, msg=" + ctx.getMessageId());
        }
        ProcessBuilder pb = new ProcessBuilder(command.commandLine());
        if (command.getDir() != null && !command.getDir().isBlank()) {
            pb.directory(new File(command.getDir()));
        }
        String msg = ctx.getMessageId();
        log.info("[Command] msg={} retry={}/{} exec {}", msg, ctx.getRetryCount(), ctx.getMaxRetries(),
                command.commandLine());

        Process process = pb.start();
        boolean finished = false;
        try {
            process.getOutputStream().close();
            Future<?> out = pumps.submit(() -> pump(process.getInputStream(), msg, false));
            Future<?> err = pumps.submit(() -> pump(process.getErrorStream(), msg, true));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Command] msg={} exceeded {}, killing pid={}", msg, timeout, process.pid());
                return false;
            }
            finished = true;
            awaitPump(out, msg);
            awaitPump(err, msg);

            int code = process.exitValue();
            if (code != 0) {
                log.warn("[Command] msg={} exited with {}", msg, code);
                return false;
            }
            log.info("[Command] msg={} exited with 0", msg);
            return true;
        } finally {
            if (!finished) {
                process.destroyForcibly();
                closeQuietly(process.getInputStream());
                closeQuietly(process.getErrorStream());
            }
        }
    }

    private static void pump(InputStream in, String msg, boolean stderr) {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                if (stderr) {
                    log.warn("[Command] msg={} stderr | {}", msg, line);
                } else {
                    log.info("[Command] msg={} stdout | {}", msg, line);
                }
            }
        } catch (IOException e) {
            // 子进程被杀时流被关闭
            log.debug("[Command] msg={} output closed: {}", msg, e.toString());
        }
    }

    /** 子进程已退出, 只等剩余输出写完 */
    private static void awaitPump(Future<?> pump, String msg) throws InterruptedException {
        try {
            pump.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.warn("[Command] msg={} output pump failed", msg, e.getCause());
        } catch (TimeoutException e) {
            pump.cancel(true);
            log.warn("[Command] msg={} output still open after exit, dropped", msg);
        }
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("[Command] close child stream failed: {}", e.toString());
        }
    }

    @Override
    public void close() {
        pumps.shutdownNow();
    }
}
