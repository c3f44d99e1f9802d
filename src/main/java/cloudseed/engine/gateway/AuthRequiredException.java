package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * No valid credential and no interactive flow available to obtain one.
 */
public class AuthRequiredException extends GatewayException {

    public AuthRequiredException(String message) {
        super(message);
    }

    public AuthRequiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTH;
    }
}
