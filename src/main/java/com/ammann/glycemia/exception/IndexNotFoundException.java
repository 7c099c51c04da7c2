/* (C)2026 */
package com.ammann.glycemia.exception;

/**
 * Exception indicating that no glycemic index is registered under the requested name.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class IndexNotFoundException extends ApiException
{
    public IndexNotFoundException(String indexName)
    {
        super(String.format("Unknown glycemic index '%s'", indexName));
    }
}
