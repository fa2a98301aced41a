package org.atoms.analogCompiler.compiler.errors;

import javax.annotation.Nullable;

/** A scalar or waveform could not be evaluated under a given assignment,
 * e.g., because a variable is not bound. */
public final class EvaluationError extends BaseCompilerException {
    public EvaluationError(String message) {
        this(message, null);
    }

    public EvaluationError(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "Evaluation error";
    }
}
