package org.descartes.validator.exceptions;

/**
 * A claim equal to the empty sentinel was submitted.
 *
 * @since 1.0
 */
public class InvalidClaimException extends ValidatorException {

    public InvalidClaimException(String msg) {
        super(msg);
    }
}
