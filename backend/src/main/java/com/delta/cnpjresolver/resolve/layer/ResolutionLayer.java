package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;

/**
 * One independent strategy for discovering a company's CNPJ. Implementations report misses and
 * unavailable sources through the returned {@link LayerAttempt} rather than by throwing.
 */
public interface ResolutionLayer {
    String name();

    LayerAttempt attempt(String companyName, CancellationToken token);
}
