package com.controlactas.repository;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * The cross-period ledger could not be read or written. Fatal to the run.
 */
public class LedgerWriteException extends UncheckedIOException {

    public LedgerWriteException(String message, IOException cause) {
        super(message, cause);
    }
}
