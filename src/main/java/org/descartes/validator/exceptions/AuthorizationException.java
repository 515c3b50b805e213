package org.descartes.validator.exceptions;

import org.jgroups.Address;

/**
 * The caller of a mutating operation is not the orchestrator the manager was created with.
 *
 * @since 1.0
 */
public class AuthorizationException extends ValidatorException {

    private final Address caller;

    public AuthorizationException(Address caller) {
        super(String.format("caller %s is not the orchestrator", caller));
        this.caller = caller;
    }

    public Address caller() {
        return caller;
    }
}
