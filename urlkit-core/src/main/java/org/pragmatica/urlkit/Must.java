package org.pragmatica.urlkit;

/**
 * Call-site sugar for the {@code must*} family: runs a fallible operation and turns its
 * failure into an unchecked {@link IllegalStateException}. The original
 * {@link UrlKitException} is kept as the cause.
 */
public final class Must {
    private Must() {}

    @FunctionalInterface
    public interface Fallible<T> {
        T get() throws UrlKitException;
    }

    public static <T> T must(Fallible<T> operation) {
        try{
            return operation.get();
        } catch (UrlKitException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
