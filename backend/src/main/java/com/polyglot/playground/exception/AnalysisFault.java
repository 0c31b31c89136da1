package com.polyglot.playground.exception;

import com.polyglot.playground.dto.Diagnostic;
import com.polyglot.playground.dto.Phase;
import com.polyglot.playground.dto.Severity;

public class AnalysisFault extends Exception {

    private final Phase phase;
    private final Severity severity;

    public AnalysisFault(Phase phase, String message) {
        this(phase, Severity.ERROR, message, null);
    }

    public AnalysisFault(Phase phase, String message, Throwable cause) {
        this(phase, Severity.ERROR, message, cause);
    }

    public AnalysisFault(Phase phase, Severity severity, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.severity = severity;
    }

    public Phase getPhase() {
        return phase;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(phase, getMessage(), 1, 1, 0, severity, null);
    }
}
