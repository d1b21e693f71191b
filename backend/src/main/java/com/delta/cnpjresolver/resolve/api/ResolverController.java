package com.delta.cnpjresolver.resolve.api;

import com.delta.cnpjresolver.resolve.model.BranchCrawlResult;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;
import com.delta.cnpjresolver.resolve.service.CompanyResolutionService;
import com.delta.cnpjresolver.resolve.service.InvalidCompanyNameException;
import com.delta.cnpjresolver.resolve.util.CnpjValidator;
import com.delta.cnpjresolver.resolve.util.SlugNormalizer;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ResolverController {
    private final CompanyResolutionService resolutionService;

    public ResolverController(CompanyResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @GetMapping("/cnpj/validate")
    public CnpjCheckResponse validate(@RequestParam(name = "value") String value) {
        String digits = CnpjValidator.extractDigits(value);
        boolean valid = CnpjValidator.isValid(digits);
        return new CnpjCheckResponse(value, digits, valid, valid ? CnpjValidator.format(digits) : null);
    }

    @GetMapping("/cnpj/slug")
    public Map<String, String> slug(@RequestParam(name = "name") String name) {
        String slug = SlugNormalizer.normalize(name);
        if (slug.isEmpty()) {
            throw new InvalidCompanyNameException("Company name has no usable characters");
        }
        return Map.of("name", name, "slug", slug, "domainToken", SlugNormalizer.domainToken(name));
    }

    @PostMapping("/resolve")
    public ResolveResponse resolve(@RequestBody ResolveRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        ResolutionResult resolution = resolutionService.resolveOnly(request.companyName());
        BranchCrawlResult branches = null;
        if (Boolean.TRUE.equals(request.includeBranches()) && resolution.hasSelection()) {
            branches = resolutionService.crawlBranches(resolution.companyName(), resolution.selected());
        }
        return new ResolveResponse(resolution, branches);
    }

    @PostMapping("/branches")
    public BranchCrawlResult branches(@RequestBody BranchesRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        Cnpj primary = Cnpj.parse(request.cnpj())
            .orElseThrow(() -> new ResponseStatusException(BAD_REQUEST, "cnpj is not a valid CNPJ"));
        return resolutionService.crawlBranches(request.companyName(), primary);
    }
}
