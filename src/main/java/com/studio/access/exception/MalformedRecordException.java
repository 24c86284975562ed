package com.studio.access.exception;

import com.studio.access.service.RecordKind;

public class MalformedRecordException extends RecordStoreException {

    public MalformedRecordException(RecordKind kind, String recordId, String field, String value,
                                    Throwable cause) {
        super(kind.label() + " " + recordId + " has malformed " + field + " '" + value + "'", cause);
    }
}
