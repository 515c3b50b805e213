package org.descartes.validator.internal;

import org.descartes.validator.ValidatorManager;
import org.descartes.validator.configuration.RuntimeProperties;
import org.descartes.validator.logger.ClaimEventLogger;
import org.descartes.validator.util.TimeService;
import org.jgroups.Address;

import java.util.List;

public final class ValidatorManagerFactory {

    private ValidatorManagerFactory() { }

    public static ValidatorManager create(
            Address orchestrator,
            List<Address> validators,
            ClaimEventLogger eventLogger,
            RuntimeProperties runtimeProperties,
            TimeService timeService) {
        return new ValidatorManagerImpl(new ValidatorManagerParameters(
                orchestrator,
                validators,
                eventLogger,
                runtimeProperties,
                timeService));
    }
}
