package org.pragmatica.urlkit;

/**
 * Base type for every urlkit failure.
 *
 * <p>Errors are plain values (usually records) grouped into sealed families per module.
 * Fallible operations surface them through {@link UrlKitException}, which keeps the
 * original value available via {@link UrlKitException#error()}.
 */
public interface UrlKitError {
    /**
     * Human readable description of the failure.
     */
    String message();

    /**
     * Wrap this error into a throwable carrier.
     */
    default UrlKitException exception() {
        return new UrlKitException(this);
    }
}
