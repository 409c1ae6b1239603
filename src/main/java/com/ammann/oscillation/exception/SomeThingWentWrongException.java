/* (C)2026 */
package com.ammann.oscillation.exception;

/**
 * Generic internal error for unexpected failures, e.g. an interrupted batch analysis.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class SomeThingWentWrongException extends ApiException
{
    public SomeThingWentWrongException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
