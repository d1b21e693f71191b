package com.delta.cnpjresolver.resolve.sink;

import com.delta.cnpjresolver.resolve.model.BranchEntry;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Destination for resolution rows. Implementations own the output format and skip rows already
 * recorded by earlier runs; appends may be called from several workers at once.
 */
public interface ResultSink {
    void appendPrimary(String companyName, ResolutionResult result);

    /**
     * @return number of rows actually written after deduplication
     */
    int appendBranches(String companyName, Cnpj anchor, List<BranchEntry> entries);

    /**
     * Writes the primary row and its branch rows together, so no other company's rows land between them.
     *
     * @return number of branch rows actually written after deduplication
     */
    int appendCompany(String companyName, ResolutionResult result, List<BranchEntry> branches);

    Set<String> processedCompanies();

    /**
     * Companies with a recorded primary CNPJ and no branch rows yet, in file order.
     */
    Map<String, Cnpj> primariesWithoutBranches();
}
