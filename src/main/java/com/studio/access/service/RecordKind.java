package com.studio.access.service;

public enum RecordKind {
    RESERVATION("reservation"),
    TEMPORARY_ACCESS("temporary");

    private final String label;

    RecordKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
