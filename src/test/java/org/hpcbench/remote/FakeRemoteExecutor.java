package org.hpcbench.remote;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scripted cluster: job ids are handed out from 1000, job states are replayed per job (the last
 * one sticks), marker files and remote files are plain strings.
 */
public final class FakeRemoteExecutor implements RemoteExecutor {
    private final Map<String, Deque<String>> jobStates = new HashMap<>();
    private final Map<String, Integer> statusQueries = new HashMap<>();
    private final Map<String, String> remoteFiles = new LinkedHashMap<>();
    private final Map<String, CommandResult> responses = new LinkedHashMap<>();
    private final Map<String, String> uploads = new LinkedHashMap<>();
    private final List<String> commands = new ArrayList<>();
    private final List<String> submitted = new ArrayList<>();
    private final List<String> cancelled = new ArrayList<>();
    private final Set<String> refusedCancels = new HashSet<>();
    private String home = "/home/bench";
    private int nextJobId = 1000;
    private int failuresRemaining;
    private boolean rejectSubmissions;

    public FakeRemoteExecutor home(String home) {
        this.home = home;
        return this;
    }

    public FakeRemoteExecutor jobStates(String jobId, String... states) {
        jobStates.put(jobId, new ArrayDeque<>(List.of(states)));
        return this;
    }

    public FakeRemoteExecutor remoteFile(String path, String content) {
        remoteFiles.put(path, content);
        return this;
    }

    /**
     * Commands starting with {@code prefix} answer with {@code result}.
     */
    public FakeRemoteExecutor respond(String prefix, CommandResult result) {
        responses.put(prefix, result);
        return this;
    }

    public FakeRemoteExecutor failNextCalls(int count) {
        this.failuresRemaining = count;
        return this;
    }

    public FakeRemoteExecutor rejectSubmissions(boolean reject) {
        this.rejectSubmissions = reject;
        return this;
    }

    public FakeRemoteExecutor refuseCancel(String jobId) {
        refusedCancels.add(jobId);
        return this;
    }

    @Override
    public synchronized CommandResult execute(String command, String workingDirectory) {
        maybeFail(command);
        commands.add(command);
        for (Map.Entry<String, CommandResult> response : responses.entrySet()) {
            if (command.startsWith(response.getKey())) {
                return response.getValue();
            }
        }
        if (command.equals("echo $HOME")) {
            return home == null ? CommandResult.failed(1, "no home") : CommandResult.ok(home + "\n");
        }
        if (command.startsWith("mkdir -p ")) {
            return CommandResult.ok("");
        }
        if (command.startsWith("test -s ")) {
            String path = command.substring("test -s ".length(), command.indexOf(" && "));
            String content = remoteFiles.get(path);
            return content == null || content.isEmpty() ? CommandResult.failed(1, "") : CommandResult.ok(content);
        }
        return CommandResult.failed(127, "unexpected command: " + command);
    }

    @Override
    public synchronized boolean upload(Path localPath, String remotePath) {
        maybeFail("upload");
        try {
            uploads.put(remotePath, Files.readString(localPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return true;
    }

    @Override
    public synchronized boolean download(String remotePath, Path localPath) {
        maybeFail("download");
        String content = remoteFiles.get(remotePath);
        if (content == null) {
            return false;
        }
        try {
            Files.createDirectories(localPath.toAbsolutePath().getParent());
            Files.writeString(localPath, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return true;
    }

    @Override
    public synchronized Optional<String> submitJob(String remoteScriptPath) {
        maybeFail("submitJob");
        if (rejectSubmissions) {
            return Optional.empty();
        }
        submitted.add(remoteScriptPath);
        return Optional.of(String.valueOf(nextJobId++));
    }

    @Override
    public synchronized Optional<String> jobStatus(String jobId) {
        maybeFail("jobStatus");
        statusQueries.merge(jobId, 1, Integer::sum);
        Deque<String> states = jobStates.get(jobId);
        if (states == null || states.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(states.size() > 1 ? states.poll() : states.peek());
    }

    @Override
    public synchronized boolean cancelJob(String jobId) {
        maybeFail("cancelJob");
        if (refusedCancels.contains(jobId)) {
            return false;
        }
        cancelled.add(jobId);
        jobStates.put(jobId, new ArrayDeque<>(List.of("CANCELLED by 0")));
        return true;
    }

    public synchronized List<String> commands() {
        return List.copyOf(commands);
    }

    public synchronized Map<String, String> uploads() {
        return Map.copyOf(uploads);
    }

    public synchronized List<String> submitted() {
        return List.copyOf(submitted);
    }

    public synchronized List<String> cancelled() {
        return List.copyOf(cancelled);
    }

    public synchronized int statusQueries(String jobId) {
        return statusQueries.getOrDefault(jobId, 0);
    }

    private void maybeFail(String call) {
        if (failuresRemaining > 0) {
            failuresRemaining--;
            throw new ConnectivityException("connection reset during " + call);
        }
    }
}
