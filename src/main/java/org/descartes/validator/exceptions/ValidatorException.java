package org.descartes.validator.exceptions;

/**
 * Base unchecked exception for the validator manager.
 *
 * <p>
 * Every subclass is raised before the failing call touches any state. A caller catching a {@link ValidatorException}
 * can assume the manager is exactly as it was before the call and may resubmit.
 * </p>
 *
 * @since 1.0
 */
public class ValidatorException extends RuntimeException {

    public ValidatorException() {
        super();
    }

    public ValidatorException(Throwable cause) {
        super(cause.getMessage(), cause);
    }

    public ValidatorException(String msg) {
        super(msg);
    }

    public ValidatorException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
