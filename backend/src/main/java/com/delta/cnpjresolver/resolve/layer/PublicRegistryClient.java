package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.http.Sleeper;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.RegistryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Queries the public CNPJ registries in configured order; the first that answers wins.
 */
@Component
public class PublicRegistryClient implements CompanyRegistryClient {
    private static final Logger log = LoggerFactory.getLogger(PublicRegistryClient.class);

    private final AntiBlockingHttpClient httpClient;
    private final ResolverProperties properties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public PublicRegistryClient(
        AntiBlockingHttpClient httpClient,
        ResolverProperties properties,
        ObjectMapper objectMapper,
        Sleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
    }

    @Override
    public Optional<RegistryRecord> lookup(Cnpj cnpj, CancellationToken token) {
        List<String> templates = properties.getRegistry().getUrlTemplates();
        FetchProfile profile = FetchProfile.registryApi(properties);
        for (int i = 0; i < templates.size(); i++) {
            if (token != null && token.isCancelled()) {
                return Optional.empty();
            }
            if (i > 0 && !pause()) {
                return Optional.empty();
            }
            String url = templates.get(i).replace("{cnpj}", cnpj.digits());
            FetchResult fetch = httpClient.fetch(url, profile, token);
            if (!fetch.isSuccessful()) {
                log.debug("Registry {} did not answer for {} ({})", url, cnpj, fetch.lastReason());
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(fetch.body());
                return Optional.of(toRecord(cnpj, root, url));
            } catch (JsonProcessingException e) {
                log.warn("Registry {} returned invalid JSON for {}: {}", url, cnpj, e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    static RegistryRecord toRecord(Cnpj cnpj, JsonNode root, String sourceUrl) {
        String legalName = root.path("razao_social").asText(null);
        return new RegistryRecord(cnpj, isHeadOffice(root), legalName, sourceUrl);
    }

    static boolean isHeadOffice(JsonNode root) {
        JsonNode identifier = root.path("identificador_matriz_filial");
        if (identifier.canConvertToInt() && identifier.asInt() == 1) {
            return true;
        }
        if (identifier.isTextual() && identifier.asText().trim().equals("1")) {
            return true;
        }
        if ("MATRIZ".equalsIgnoreCase(root.path("descricao_identificador_matriz_filial").asText("").trim())) {
            return true;
        }
        return "MATRIZ".equalsIgnoreCase(root.path("estabelecimento").path("tipo").asText("").trim());
    }

    private boolean pause() {
        try {
            sleeper.sleep(Duration.ofMillis(properties.getRegistry().getPauseMs()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
