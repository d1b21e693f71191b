package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.RegistryRecord;

import java.util.Optional;

public interface CompanyRegistryClient {
    /**
     * Empty when no registry answered for this CNPJ.
     */
    Optional<RegistryRecord> lookup(Cnpj cnpj, CancellationToken token);
}
