package com.example.scanner.models;

import java.util.Objects;

/**
 * An identifier-shaped substring that has not been validated yet.
 */
public class IdentifierCandidate {
    public final String value;
    public final IdentifierKind kind;
    public final CandidateOrigin origin;
    public final SourceMethod sourceMethod;

    public IdentifierCandidate(String value, IdentifierKind kind,
                               CandidateOrigin origin, SourceMethod sourceMethod) {
        this.value = Objects.requireNonNull(value, "value");
        this.kind = kind;
        this.origin = origin;
        this.sourceMethod = sourceMethod;
    }

    public IdentifierCandidate withOrigin(CandidateOrigin newOrigin) {
        return new IdentifierCandidate(value, kind, newOrigin, sourceMethod);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierCandidate)) return false;
        IdentifierCandidate that = (IdentifierCandidate) o;
        return value.equals(that.value) && kind == that.kind
                && origin == that.origin && sourceMethod == that.sourceMethod;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind, origin, sourceMethod);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ", " + origin + ", " + sourceMethod + ")";
    }
}
