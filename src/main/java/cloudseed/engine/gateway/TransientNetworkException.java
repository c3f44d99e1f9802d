package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Connection failure, timeout, rate limit or server-side hiccup. Worth retrying.
 */
public class TransientNetworkException extends GatewayException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
