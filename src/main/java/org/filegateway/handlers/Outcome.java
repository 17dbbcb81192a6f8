package org.filegateway.handlers;

/**
 * Result category of a gateway operation. Mapped to an HTTP status only
 * when the response is written.
 */
public enum Outcome {
    OK,
    BAD_REQUEST,
    UNAUTHORIZED,
    NOT_FOUND,
    METHOD_NOT_ALLOWED,
    CONFLICT,
    PAYLOAD_TOO_LARGE,
    INTERNAL
}
