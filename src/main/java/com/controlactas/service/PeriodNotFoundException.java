package com.controlactas.service;

/**
 * No month folder with this name, or the name has no recognizable period.
 */
public class PeriodNotFoundException extends RuntimeException {

    public PeriodNotFoundException(String folderName) {
        super("Period folder not found: " + folderName);
    }
}
