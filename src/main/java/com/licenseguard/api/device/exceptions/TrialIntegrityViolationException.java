package com.licenseguard.api.device.exceptions;

/**
 * Thrown when the stored trial of a device breaks an invariant that the trial state machine
 * guarantees, e.g. a duration other than exactly 14 days. It indicates tampering or a defect and
 * is never corrected automatically.
 */
public class TrialIntegrityViolationException extends RuntimeException {

    public TrialIntegrityViolationException(String message) {
        super(message);
    }
}
