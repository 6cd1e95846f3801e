package com.vaultstake.custody;

/**
 * Raised by a custody collaborator when a transfer cannot be completed.
 * The surrounding staking operation is rolled back.
 */
public class CustodyTransferException extends RuntimeException {

    public CustodyTransferException(String message) {
        super(message);
    }
}
