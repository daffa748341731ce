package com.casework.core.model;

/**
 * Kinds of case records. Each kind has its own record number prefix.
 */
public enum RecordType {
    INCIDENT("INC"),
    REQUEST("REQ"),
    COMPLAINT("COMP"),
    QUERY("QRY");

    private final String numberPrefix;

    RecordType(String numberPrefix) {
        this.numberPrefix = numberPrefix;
    }

    public String numberPrefix() {
        return numberPrefix;
    }

    /**
     * Format a record number such as {@code INC-2026-000042}.
     */
    public String formatNumber(int year, long sequence) {
        return String.format("%s-%d-%06d", numberPrefix, year, sequence);
    }
}
