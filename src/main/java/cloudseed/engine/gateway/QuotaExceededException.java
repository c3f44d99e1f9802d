package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Cloud storage is out of space.
 */
public class QuotaExceededException extends GatewayException {

    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}
