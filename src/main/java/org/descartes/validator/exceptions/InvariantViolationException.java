package org.descartes.validator.exceptions;

/**
 * Internal consistency check failed. This signals a logic error and not a condition a caller can fix by resubmitting.
 *
 * @since 1.0
 */
public class InvariantViolationException extends ValidatorException {

    public InvariantViolationException(String msg) {
        super(msg);
    }
}
