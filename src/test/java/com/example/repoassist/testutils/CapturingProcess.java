package com.example.repoassist.testutils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.TimeUnit;

/** Process stand-in that records stdin and replays fixed stdout/stderr. */
public class CapturingProcess extends Process {
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final ByteArrayInputStream stdout;
    private final ByteArrayInputStream stderr;
    private final int exitCode;
    private final boolean finishes;
    private boolean destroyed;

    public CapturingProcess(byte[] stdoutBytes, byte[] stderrBytes, int exitCode) {
        this(stdoutBytes, stderrBytes, exitCode, true);
    }

    /** @param finishes false simulates a process that never exits within the wait */
    public CapturingProcess(byte[] stdoutBytes, byte[] stderrBytes, int exitCode, boolean finishes) {
        this.stdout = new ByteArrayInputStream(stdoutBytes == null ? new byte[0] : stdoutBytes);
        this.stderr = new ByteArrayInputStream(stderrBytes == null ? new byte[0] : stderrBytes);
        this.exitCode = exitCode;
        this.finishes = finishes;
    }

    public static CapturingProcess answering(String stdout) {
        return new CapturingProcess(stdout.getBytes(java.nio.charset.StandardCharsets.UTF_8), new byte[0], 0);
    }

    @Override
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                stdin.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                stdin.write(b, off, len);
            }
        };
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() {
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) {
        return finishes;
    }

    @Override
    public int exitValue() {
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyed = true;
    }

    @Override
    public Process destroyForcibly() {
        destroyed = true;
        return this;
    }

    @Override
    public boolean isAlive() {
        return !finishes && !destroyed;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public byte[] getCapturedStdin() {
        return stdin.toByteArray();
    }
}
