/* (C)2026 */
package com.ammann.oscillation.exception;

/**
 * Base unchecked exception for errors raised at the REST boundary of the oscillation analyzer.
 *
 * <p>The analysis pipeline itself reports expected-shape problems through
 * {@link com.ammann.oscillation.enumeration.AnalysisStatus}; subclasses of this exception cover
 * client errors and unreadable input, and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
