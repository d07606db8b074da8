package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

/**
 * Signals a spreadsheet error from deep inside a coercion or a function body.
 * <p>
 * Function bodies coerce their arguments through {@link Coercions}; when an argument is an error
 * or cannot be coerced, the coercion throws this signal and the evaluator turns it back into an
 * {@link EvaluatedValue.ErrorValue} at the call boundary. It never escapes the evaluator and
 * carries no stack trace.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationError extends RuntimeException {

    private final ErrorKind kind;

    public EvaluationError(ErrorKind kind) {
        super(kind.code(), null, false, false);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public EvaluatedValue toValue() {
        return EvaluatedValue.error(kind);
    }
}
