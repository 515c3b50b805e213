package org.descartes.validator.internal;

import org.descartes.validator.configuration.RuntimeProperties;
import org.descartes.validator.logger.ClaimEventLogger;
import org.descartes.validator.util.TimeService;
import org.jgroups.Address;

import java.util.List;

record ValidatorManagerParameters(Address orchestrator,
                                  List<Address> validators,
                                  ClaimEventLogger eventLogger,
                                  RuntimeProperties runtimeProperties,
                                  TimeService timeService) {
}
