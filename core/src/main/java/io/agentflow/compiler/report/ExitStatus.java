package io.agentflow.compiler.report;

import io.agentflow.compiler.model.CompilationResult;
import java.util.Collection;

/** Process exit codes a command-line front end derives from compilation results. */
public enum ExitStatus {
    /** Every file is valid; warnings allowed. */
    VALID(0),
    /** At least one file has error diagnostics. */
    ERRORS(1),
    /** A file could not be read. */
    FILE_ERROR(2);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitStatus of(CompilationResult result) {
        if (result.isFileError()) {
            return FILE_ERROR;
        }
        return result.isSuccess() ? VALID : ERRORS;
    }

    /** The most severe status over several files. */
    public static ExitStatus of(Collection<CompilationResult> results) {
        ExitStatus worst = VALID;
        for (CompilationResult result : results) {
            ExitStatus status = of(result);
            if (status.code > worst.code) {
                worst = status;
            }
        }
        return worst;
    }
}
