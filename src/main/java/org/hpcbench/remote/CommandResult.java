package org.hpcbench.remote;

/**
 * Outcome of a remote command.
 */
public final class CommandResult {
    private final String stdout;
    private final String stderr;
    private final int exitCode;

    public CommandResult(String stdout, String stderr, int exitCode) {
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.exitCode = exitCode;
    }

    public static CommandResult ok(String stdout) {
        return new CommandResult(stdout, "", 0);
    }

    public static CommandResult failed(int exitCode, String stderr) {
        return new CommandResult("", stderr, exitCode);
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    @Override
    public String toString() {
        return "CommandResult{exitCode=" + exitCode + ", stdout=" + stdout.length() + " chars, stderr="
            + stderr.length() + " chars}";
    }
}
