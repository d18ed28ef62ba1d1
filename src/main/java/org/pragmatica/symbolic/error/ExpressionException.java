package org.pragmatica.symbolic.error;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Unchecked carrier of an {@link ExpressionError}. Thrown by every core operation; the
 * caller decides whether to report and continue.
 */
public final class ExpressionException extends RuntimeException {
    private final ExpressionError error;

    public ExpressionException(ExpressionError error) {
        super(checkNotNull(error, "error").message());
        this.error = error;
    }

    public ExpressionError error() {
        return error;
    }
}
