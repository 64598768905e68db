package org.pragmatica.urlkit;

/**
 * Checked carrier for {@link UrlKitError} values.
 */
public final class UrlKitException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient UrlKitError error;

    public UrlKitException(UrlKitError error) {
        super(error.message());
        this.error = error;
    }

    public UrlKitError error() {
        return error;
    }
}
