package com.zzf.orchestrator.shell;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Process-tree termination for spawned commands.
 */
@Slf4j
public class ShellService {

    private static final long SIGKILL_TIMEOUT_MS = 200;

    public void killTree(Process process) {
        if (process == null || !process.isAlive()) return;

        long pid = process.pid();
        log.info("shell.kill_tree pid={}", pid);

        if (isWindows()) {
            try {
                new ProcessBuilder("taskkill", "/pid", String.valueOf(pid), "/f", "/t")
                        .inheritIO()
                        .start()
                        .waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("shell.kill_tree_failed pid={}", pid, e);
            }
            return;
        }

        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroy);
        try {
            process.destroy();
            if (!process.waitFor(SIGKILL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        for (ProcessHandle child : descendants) {
            if (child.isAlive()) {
                child.destroyForcibly();
            }
        }
    }

    public boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
