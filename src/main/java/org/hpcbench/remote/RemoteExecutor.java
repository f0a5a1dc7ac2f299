package org.hpcbench.remote;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Channel to the cluster: remote commands, file transfer and scheduler job control.
 *
 * <p>Every call blocks the invoking thread. Implementations do not retry; a transient channel
 * failure is reported by throwing {@link ConnectivityException} and retry policy belongs to the
 * caller.
 */
public interface RemoteExecutor {
    CommandResult execute(String command, String workingDirectory);

    default CommandResult execute(String command) {
        return execute(command, null);
    }

    boolean upload(Path localPath, String remotePath);

    boolean download(String remotePath, Path localPath);

    /**
     * Submits a job script already present on the cluster.
     *
     * @return the scheduler job id, or empty when the scheduler rejected the submission
     */
    Optional<String> submitJob(String remoteScriptPath);

    /**
     * Raw scheduler state string such as {@code PENDING} or {@code CANCELLED by 1234}.
     */
    Optional<String> jobStatus(String jobId);

    boolean cancelJob(String jobId);
}
