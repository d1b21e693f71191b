package com.delta.cnpjresolver.resolve.model;

import java.util.List;

/**
 * Output of one discovery layer. {@code completed} is false when the layer faulted instead of returning.
 */
public record LayerAttempt(
    String layer,
    List<Cnpj> candidates,
    String sourceUrl,
    String note,
    FailureKind failure,
    boolean completed
) {
    public LayerAttempt {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static LayerAttempt found(String layer, List<Cnpj> candidates, String sourceUrl, String note) {
        return new LayerAttempt(layer, candidates, sourceUrl, note, null, true);
    }

    public static LayerAttempt miss(String layer, String sourceUrl, String note) {
        return new LayerAttempt(layer, List.of(), sourceUrl, note, FailureKind.PARSE_MISS, true);
    }

    public static LayerAttempt unavailable(String layer, String note) {
        return new LayerAttempt(layer, List.of(), null, note, FailureKind.SOURCE_UNAVAILABLE, true);
    }

    public static LayerAttempt faulted(String layer, String note) {
        return new LayerAttempt(layer, List.of(), null, note, FailureKind.FATAL, false);
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }

    public String trailEntry() {
        return layer + ": " + note;
    }
}
