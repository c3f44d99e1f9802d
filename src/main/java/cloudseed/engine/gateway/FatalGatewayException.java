package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Request permanently rejected; retrying will not help.
 */
public class FatalGatewayException extends GatewayException {

    public FatalGatewayException(String message) {
        super(message);
    }

    public FatalGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}
