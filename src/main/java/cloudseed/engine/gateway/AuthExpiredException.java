package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Credential was rejected by the remote service.
 */
public class AuthExpiredException extends GatewayException {

    public AuthExpiredException(String message) {
        super(message);
    }

    public AuthExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTH;
    }
}
