package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Source string is not a usable magnet URI, torrent file or torrent URL.
 */
public class InvalidSourceException extends GatewayException {

    public InvalidSourceException(String message) {
        super(message);
    }

    public InvalidSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INPUT;
    }
}
