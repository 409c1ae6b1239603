/* (C)2026 */
package com.ammann.oscillation.exception;

import com.ammann.oscillation.enumeration.AnalysisStatus;

/**
 * Raised when an uploaded trace contains no parseable numeric rows.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class EmptyTraceException extends ApiException
{
    public EmptyTraceException()
    {
        super(AnalysisStatus.EMPTY_INPUT.getMessage());
    }
}
