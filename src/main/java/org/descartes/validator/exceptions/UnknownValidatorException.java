package org.descartes.validator.exceptions;

import org.jgroups.Address;

/**
 * The identity does not match any occupied roster slot. Removed validators fall in this category as well, their slot
 * is tombstoned and never matches again.
 *
 * @since 1.0
 */
public class UnknownValidatorException extends ValidatorException {

    private final Address validator;

    public UnknownValidatorException(Address validator) {
        super(String.format("%s is not an active validator", validator));
        this.validator = validator;
    }

    public Address validator() {
        return validator;
    }
}
