package com.zzf.orchestrator.core.tool;

import com.zzf.orchestrator.shell.ShellService;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command as an argv list, without a shell, and tracks the process by call id so the
 * dispatcher can kill it.
 */
@Slf4j
public class CommandExecutor {
    private static final long SHUTDOWN_JOIN_MS = 500;

    private final ShellService shellService;
    private final int maxOutputBytes;
    private final Map<String, Process> runningProcessesByCall = new ConcurrentHashMap<>();

    public CommandExecutor(ShellService shellService, int maxOutputBytes) {
        this.shellService = shellService;
        this.maxOutputBytes = maxOutputBytes;
    }

    public void cancel(String callId) {
        if (callId == null || callId.isBlank()) {
            return;
        }
        Process process = runningProcessesByCall.remove(callId);
        if (process != null && process.isAlive()) {
            log.info("command.cancel callId={} pid={}", callId, process.pid());
            shellService.killTree(process);
        }
    }

    public boolean isRunning(String callId) {
        Process process = callId == null ? null : runningProcessesByCall.get(callId);
        return process != null && process.isAlive();
    }

    ExecutionResult execute(String callId, List<String> argv, Path workdir, long timeoutMs) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(argv));
        pb.directory(workdir.toFile());
        long startedAt = System.currentTimeMillis();
        Process process = pb.start();
        if (callId != null && !callId.isBlank()) {
            runningProcessesByCall.put(callId, process);
        }
        StreamCollector stdout = new StreamCollector(process.getInputStream(), maxOutputBytes);
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), maxOutputBytes);
        stdout.start();
        stderr.start();
        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                shellService.killTree(process);
                stdout.join(SHUTDOWN_JOIN_MS);
                stderr.join(SHUTDOWN_JOIN_MS);
                return new ExecutionResult(-1, stdout.text(), stderr.text(), true, System.currentTimeMillis() - startedAt);
            }
            stdout.join();
            stderr.join();
            return new ExecutionResult(process.exitValue(), stdout.text(), stderr.text(), false, System.currentTimeMillis() - startedAt);
        } catch (InterruptedException e) {
            shellService.killTree(process);
            throw e;
        } finally {
            if (callId != null && !callId.isBlank()) {
                runningProcessesByCall.remove(callId, process);
            }
        }
    }

    private static final class StreamCollector extends Thread {
        private final InputStream in;
        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean truncated;

        private StreamCollector(InputStream in, int limit) {
            this.in = in;
            this.limit = limit;
            setDaemon(true);
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = limit - buffer.size();
                        if (room > 0) {
                            buffer.write(chunk, 0, Math.min(n, room));
                        }
                        if (n > room) {
                            truncated = true;
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("command.stream_closed err={}", e.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                String value = buffer.toString(StandardCharsets.UTF_8);
                return truncated ? value + "\n[output truncated]" : value;
            }
        }
    }

    static final class ExecutionResult {
        final int exitCode;
        final String stdout;
        final String stderr;
        final boolean timedOut;
        final long durationMs;

        ExecutionResult(int exitCode, String stdout, String stderr, boolean timedOut, long durationMs) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
            this.durationMs = durationMs;
        }
    }
}
