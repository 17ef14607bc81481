package com.controlactas.service.reference;

/**
 * Exact-mode lookup key.
 */
record PriceKey(String description, String unit) {}
