package cloudseed.engine.gateway;

import cloudseed.engine.model.ErrorKind;

/**
 * Base class for failures reported by the download or upload gateway.
 * The {@link ErrorKind} decides how the orchestrator reacts.
 */
public abstract class GatewayException extends Exception {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
