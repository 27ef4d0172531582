package com.electionlens.boothrecon.exception;

/**
 * Thrown when contest inputs are malformed: no official candidates, negative or duplicate
 * official entries, or declared out-of-booth votes outside {@code [0, official]}.
 */
public class InvalidContestDataException extends BoothReconException {

    public InvalidContestDataException(String message) {
        super("Invalid contest data: " + message);
    }
}
