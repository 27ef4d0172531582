package com.electionlens.boothrecon.exception;

/**
 * Base exception for all booth-reconciliation errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class BoothReconException extends RuntimeException {

    public BoothReconException(String message) {
        super(message);
    }

    public BoothReconException(String message, Throwable cause) {
        super(message, cause);
    }
}
