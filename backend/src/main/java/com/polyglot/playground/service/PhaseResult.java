package com.polyglot.playground.service;

import com.polyglot.playground.exception.AnalysisFault;

import java.util.Optional;

public record PhaseResult<T>(T value, AnalysisFault fault) {

    public static <T> PhaseResult<T> success(T value) {
        return new PhaseResult<>(value, null);
    }

    public static <T> PhaseResult<T> failure(AnalysisFault fault, T partial) {
        return new PhaseResult<>(partial, fault);
    }

    public boolean failed() {
        return fault != null;
    }

    public Optional<AnalysisFault> faultIfAny() {
        return Optional.ofNullable(fault);
    }
}
