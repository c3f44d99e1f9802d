package cloudseed.engine.gateway;

/**
 * Peer-to-peer download engine, accessed by opaque handle.
 */
public interface DownloadGateway {

    /**
     * Hand a source to the download engine.
     *
     * @param source magnet URI, path to a .torrent file or URL of a .torrent
     * @return handle identifying the transfer in later calls
     * @throws InvalidSourceException if the source is malformed or unreadable
     */
    String submit(String source) throws GatewayException;

    /**
     * Query the current state of a transfer.
     *
     * @param handle handle returned by {@link #submit(String)}
     */
    DownloadStatus status(String handle) throws GatewayException;

    /**
     * Stop a transfer and forget it.
     *
     * @param handle     handle returned by {@link #submit(String)}
     * @param purgeFiles also delete the downloaded content
     */
    void cancel(String handle, boolean purgeFiles) throws GatewayException;
}
