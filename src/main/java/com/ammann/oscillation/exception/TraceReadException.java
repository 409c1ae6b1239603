/* (C)2026 */
package com.ammann.oscillation.exception;

/**
 * Failure to read or decode a trace upload. This is the only fatal condition of an analysis.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class TraceReadException extends ApiException
{
    public TraceReadException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
