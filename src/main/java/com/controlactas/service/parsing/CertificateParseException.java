package com.controlactas.service.parsing;

import com.controlactas.model.FailureKind;
import lombok.Getter;

/**
 * A certificate could not be read at all. The batch skips it and continues.
 */
@Getter
public class CertificateParseException extends RuntimeException {

    private final FailureKind kind;

    public CertificateParseException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CertificateParseException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
