package org.tlsfixtures.extras;

/**
 * This exception indicates that key or certificate material could not be generated or written.
 */
public class ProvisioningException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
