package com.delta.cnpjresolver.resolve.service;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.Sleeper;
import com.delta.cnpjresolver.resolve.layer.CompanyRegistryClient;
import com.delta.cnpjresolver.resolve.layer.ResolutionLayer;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.delta.cnpjresolver.resolve.model.RegistryRecord;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;
import com.delta.cnpjresolver.resolve.model.ResolutionStatus;
import com.delta.cnpjresolver.resolve.util.ReasonCodes;
import com.delta.cnpjresolver.resolve.util.SlugNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tries each discovery layer in priority order until one yields a valid CNPJ, then uses the
 * company registry to pick the head office when several candidates were found.
 */
@Service
public class LayeredResolver {
    private static final Logger log = LoggerFactory.getLogger(LayeredResolver.class);

    private final List<ResolutionLayer> layers;
    private final CompanyRegistryClient registryClient;
    private final ResolverProperties properties;
    private final Sleeper sleeper;

    public LayeredResolver(
        List<ResolutionLayer> availableLayers,
        CompanyRegistryClient registryClient,
        ResolverProperties properties,
        Sleeper sleeper
    ) {
        this.layers = orderLayers(availableLayers, properties.getLayers().getOrder());
        this.registryClient = registryClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public List<String> layerNames() {
        return layers.stream().map(ResolutionLayer::name).toList();
    }

    public static String requireUsableName(String companyName) {
        if (companyName == null || SlugNormalizer.normalize(companyName).isEmpty()) {
            throw new InvalidCompanyNameException("Company name is empty after normalization: '" + companyName + "'");
        }
        return companyName.trim();
    }

    public ResolutionResult resolve(String companyName, CancellationToken token) {
        String name;
        try {
            name = requireUsableName(companyName);
        } catch (InvalidCompanyNameException e) {
            log.warn("Rejected company name '{}'", companyName);
            return ResolutionResult.error(companyName, List.of("input: " + e.getMessage()));
        }
        CancellationToken effectiveToken = token == null ? CancellationToken.none() : token;

        List<String> trail = new ArrayList<>();
        Set<Cnpj> candidates = new LinkedHashSet<>();
        String sourceUrl = null;
        boolean anyCompleted = false;
        Duration interLayerDelay = Duration.ofMillis(properties.getLayers().getInterLayerDelayMs());

        for (int i = 0; i < layers.size(); i++) {
            ResolutionLayer layer = layers.get(i);
            if (effectiveToken.isCancelled() || (i > 0 && !pause(interLayerDelay))) {
                trail.add(layer.name() + ": not attempted, " + stopReason(effectiveToken));
                break;
            }
            LayerAttempt attempt = runLayer(layer, name, effectiveToken);
            trail.add(attempt.trailEntry());
            anyCompleted |= attempt.completed();
            if (attempt.hasCandidates()) {
                candidates.addAll(attempt.candidates());
                sourceUrl = attempt.sourceUrl();
                break;
            }
        }

        if (candidates.isEmpty()) {
            ResolutionStatus status = anyCompleted ? ResolutionStatus.NOT_FOUND : ResolutionStatus.ERROR;
            log.info("No CNPJ found for {} ({})", name, status);
            return new ResolutionResult(name, null, List.of(), null, status, trail, false);
        }

        List<Cnpj> unique = new ArrayList<>(candidates);
        if (unique.size() == 1) {
            log.info("Resolved {} to {}", name, unique.get(0));
            return new ResolutionResult(name, unique.get(0), unique, sourceUrl, ResolutionStatus.SUCCESS, trail, false);
        }

        Cnpj selected = unique.get(0);
        boolean headOffice = false;
        if (properties.getRegistry().isEnabled()) {
            Optional<Cnpj> matriz = findHeadOffice(unique, effectiveToken);
            if (matriz.isPresent()) {
                selected = matriz.get();
                headOffice = true;
                trail.add("registry: " + selected + " validated as MATRIZ");
            } else {
                trail.add("registry: no matriz confirmation");
            }
        }
        String summary = "Multiple CNPJs found: "
            + unique.stream().map(Cnpj::formatted).collect(Collectors.joining(", "))
            + ". Selected: " + selected
            + (headOffice ? " (MATRIZ)" : "");
        trail.add(0, summary);
        log.info("Resolved {} to {} out of {} candidates (matriz={})", name, selected, unique.size(), headOffice);
        return new ResolutionResult(name, selected, unique, sourceUrl, ResolutionStatus.MULTIPLE, trail, headOffice);
    }

    private LayerAttempt runLayer(ResolutionLayer layer, String companyName, CancellationToken token) {
        try {
            LayerAttempt attempt = layer.attempt(companyName, token);
            if (attempt == null) {
                return LayerAttempt.faulted(layer.name(), ReasonCodes.LAYER_ERROR + ", no result");
            }
            return attempt;
        } catch (ResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Layer {} failed for {}: {}", layer.name(), companyName, e.toString(), e);
            return LayerAttempt.faulted(layer.name(), ReasonCodes.LAYER_ERROR + ", " + e.getClass().getSimpleName());
        }
    }

    private Optional<Cnpj> findHeadOffice(List<Cnpj> candidates, CancellationToken token) {
        Duration pause = Duration.ofMillis(properties.getRegistry().getPauseMs());
        for (int i = 0; i < candidates.size(); i++) {
            if (token.isCancelled() || (i > 0 && !pause(pause))) {
                return Optional.empty();
            }
            Cnpj candidate = candidates.get(i);
            try {
                Optional<RegistryRecord> record = registryClient.lookup(candidate, token);
                if (record.isPresent() && record.get().headOffice()) {
                    return Optional.of(candidate);
                }
            } catch (ResolutionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Registry lookup failed for {}: {}", candidate, e.toString());
            }
        }
        return Optional.empty();
    }

    private boolean pause(Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String stopReason(CancellationToken token) {
        String reason = token.reason();
        return reason == null ? ReasonCodes.CANCELLED : reason;
    }

    static List<ResolutionLayer> orderLayers(List<ResolutionLayer> available, List<String> order) {
        Map<String, ResolutionLayer> byName = new LinkedHashMap<>();
        for (ResolutionLayer layer : available) {
            byName.put(layer.name().toLowerCase(Locale.ROOT), layer);
        }
        if (order == null || order.isEmpty()) {
            return List.copyOf(byName.values());
        }
        List<ResolutionLayer> ordered = new ArrayList<>();
        for (String name : order) {
            if (name == null || name.isBlank()) {
                continue;
            }
            ResolutionLayer layer = byName.get(name.trim().toLowerCase(Locale.ROOT));
            if (layer == null) {
                throw new ResolutionException("Unknown resolution layer '" + name + "', available: " + byName.keySet());
            }
            if (!ordered.contains(layer)) {
                ordered.add(layer);
            }
        }
        return List.copyOf(ordered);
    }
}
