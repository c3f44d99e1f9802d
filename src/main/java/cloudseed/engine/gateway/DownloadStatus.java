package cloudseed.engine.gateway;

import java.util.Objects;

/**
 * Snapshot of a transfer as reported by the download engine.
 *
 * @param state     coarse transfer state
 * @param progress  fraction in [0,1], advisory
 * @param name      display name, may be null before metadata arrives
 * @param localPath completed content location, set when state is COMPLETE
 * @param error     engine error text, set when state is ERROR
 */
public record DownloadStatus(
        State state,
        double progress,
        String name,
        String localPath,
        String error) {

    public enum State {
        QUEUED,
        ACTIVE,
        COMPLETE,
        ERROR
    }

    public DownloadStatus {
        Objects.requireNonNull(state, "state is required");
        if (state == State.COMPLETE && (localPath == null || localPath.isBlank())) {
            throw new IllegalArgumentException("complete status requires a local path");
        }
    }

    public static DownloadStatus active(String name, double progress) {
        return new DownloadStatus(State.ACTIVE, progress, name, null, null);
    }

    public static DownloadStatus complete(String name, String localPath) {
        return new DownloadStatus(State.COMPLETE, 1.0, name, localPath, null);
    }

    public static DownloadStatus error(String name, String error) {
        return new DownloadStatus(State.ERROR, 0.0, name, null, error);
    }
}
