package io.peerbench.bank.error;

/**
 * The bulk download form answered with something the handshake cannot continue from:
 * missing state tokens, an unexpected status or an HTML page where an archive was due.
 */
public class ProtocolStateException extends RuntimeException {
    private final byte[] responseBody;

    public ProtocolStateException(String message) {
        this(message, null);
    }

    public ProtocolStateException(String message, byte[] responseBody) {
        super(message);
        this.responseBody = responseBody;
    }

    /** Raw body of the offending response, kept for diagnosis; may be null. */
    public byte[] responseBody() { return responseBody; }
}
