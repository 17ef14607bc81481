package com.controlactas.model;

/**
 * A processing period, derived from the name of a month folder (e.g. "julio2025").
 *
 * @param year       four digit year
 * @param month      canonical Spanish month name ("julio")
 * @param folderName folder the certificates live in
 */
public record Period(
    int year,
    String month,
    String folderName
) {}
