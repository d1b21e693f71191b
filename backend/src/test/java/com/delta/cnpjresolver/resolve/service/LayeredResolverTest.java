package com.delta.cnpjresolver.resolve.service;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.layer.CompanyRegistryClient;
import com.delta.cnpjresolver.resolve.layer.ResolutionLayer;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.delta.cnpjresolver.resolve.model.RegistryRecord;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;
import com.delta.cnpjresolver.resolve.model.ResolutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LayeredResolverTest {
    private static final Cnpj HEAD_OFFICE = Cnpj.parse("07.689.002/0001-89").orElseThrow();
    private static final Cnpj BRANCH = Cnpj.parse("07.689.002/0002-60").orElseThrow();

    @Mock
    private CompanyRegistryClient registryClient;

    private ResolverProperties properties;
    private List<Duration> pauses;

    @BeforeEach
    void setUp() {
        properties = new ResolverProperties();
        properties.getLayers().setInterLayerDelayMs(0);
        properties.getRegistry().setPauseMs(0);
        pauses = new ArrayList<>();
    }

    @Test
    void notFoundListsEveryLayerInTrail() {
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.unavailable("website", "No valid website found")),
            new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "No Wikipedia page found")),
            new StubLayer("search-engine", name -> LayerAttempt.unavailable("search-engine", "Skipped, no_api_key"))
        );

        ResolutionResult result = resolver.resolve("Empresa Fantasma Ltda", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
        assertThat(result.selected()).isNull();
        assertThat(result.trail()).containsExactly(
            "website: No valid website found",
            "encyclopedia: No Wikipedia page found",
            "search-engine: Skipped, no_api_key"
        );
        verifyNoInteractions(registryClient);
    }

    @Test
    void stopsAtFirstLayerWithCandidates() {
        StubLayer encyclopedia = new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "unused"));
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.found("website", List.of(HEAD_OFFICE), "https://embraer.com.br", "Found on website https://embraer.com.br")),
            encyclopedia,
            new StubLayer("search-engine", name -> LayerAttempt.miss("search-engine", null, "unused"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.SUCCESS);
        assertThat(result.selected()).isEqualTo(HEAD_OFFICE);
        assertThat(result.sourceUrl()).isEqualTo("https://embraer.com.br");
        assertThat(result.trail()).containsExactly("website: Found on website https://embraer.com.br");
        assertThat(encyclopedia.calls).isZero();
    }

    @Test
    void multipleCandidatesPreferRegistryHeadOffice() {
        when(registryClient.lookup(eq(BRANCH), any()))
            .thenReturn(Optional.of(new RegistryRecord(BRANCH, false, "EMBRAER S.A.", "http://registry")));
        when(registryClient.lookup(eq(HEAD_OFFICE), any()))
            .thenReturn(Optional.of(new RegistryRecord(HEAD_OFFICE, true, "EMBRAER S.A.", "http://registry")));
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.found("website", List.of(BRANCH, HEAD_OFFICE), "https://embraer.com.br", "Found on website https://embraer.com.br")),
            new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "unused")),
            new StubLayer("search-engine", name -> LayerAttempt.miss("search-engine", null, "unused"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.MULTIPLE);
        assertThat(result.selected()).isEqualTo(HEAD_OFFICE);
        assertThat(result.headOfficeConfirmed()).isTrue();
        assertThat(result.candidates()).containsExactly(BRANCH, HEAD_OFFICE);
        assertThat(result.trail().get(0))
            .isEqualTo("Multiple CNPJs found: 07.689.002/0002-60, 07.689.002/0001-89. Selected: 07.689.002/0001-89 (MATRIZ)");
        assertThat(result.trail()).contains("registry: 07.689.002/0001-89 validated as MATRIZ");
    }

    @Test
    void multipleCandidatesKeepFirstWithoutRegistryConfirmation() {
        when(registryClient.lookup(any(), any())).thenReturn(Optional.empty());
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.found("website", List.of(BRANCH, HEAD_OFFICE), null, "Found on website x"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.MULTIPLE);
        assertThat(result.selected()).isEqualTo(BRANCH);
        assertThat(result.headOfficeConfirmed()).isFalse();
        assertThat(result.trail().get(0))
            .isEqualTo("Multiple CNPJs found: 07.689.002/0002-60, 07.689.002/0001-89. Selected: 07.689.002/0002-60");
        assertThat(result.trail()).endsWith("registry: no matriz confirmation");
    }

    @Test
    void faultingLayerDoesNotStopLaterLayers() {
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> {
                throw new IllegalStateException("boom");
            }),
            new StubLayer("encyclopedia", name -> LayerAttempt.found("encyclopedia", List.of(HEAD_OFFICE), "https://pt.wikipedia.org/wiki/Embraer", "Found on Wikipedia page Embraer"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.SUCCESS);
        assertThat(result.trail()).containsExactly(
            "website: layer_error, IllegalStateException",
            "encyclopedia: Found on Wikipedia page Embraer"
        );
    }

    @Test
    void everyLayerFaultingIsAnError() {
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> {
                throw new IllegalStateException("boom");
            }),
            new StubLayer("encyclopedia", name -> null)
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.ERROR);
        assertThat(result.trail()).containsExactly("website: layer_error, IllegalStateException", "encyclopedia: layer_error, no result");
    }

    @Test
    void unusableNameIsRejectedWithoutCallingLayers() {
        StubLayer website = new StubLayer("website", name -> LayerAttempt.miss("website", null, "unused"));
        LayeredResolver resolver = resolver(website);

        ResolutionResult result = resolver.resolve("  &  ", CancellationToken.none());

        assertThat(result.status()).isEqualTo(ResolutionStatus.ERROR);
        assertThat(result.trail()).hasSize(1);
        assertThat(result.trail().get(0)).startsWith("input: ");
        assertThat(website.calls).isZero();
    }

    @Test
    void resolutionExceptionPropagates() {
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> {
                throw new ResolutionException("sink broken");
            })
        );

        assertThatThrownBy(() -> resolver.resolve("Embraer", CancellationToken.none()))
            .isInstanceOf(ResolutionException.class)
            .hasMessage("sink broken");
    }

    @Test
    void cancelledTokenRecordsSkippedLayer() {
        CancellationToken token = CancellationToken.none();
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> {
                token.cancel();
                return LayerAttempt.miss("website", null, "No CNPJ on website");
            }),
            new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "unused"))
        );

        ResolutionResult result = resolver.resolve("Embraer", token);

        assertThat(result.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
        assertThat(result.trail()).containsExactly("website: No CNPJ on website", "encyclopedia: not attempted, cancelled");
    }

    @Test
    void pausesBetweenLayers() {
        properties.getLayers().setInterLayerDelayMs(1000);
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.miss("website", null, "a")),
            new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "b")),
            new StubLayer("search-engine", name -> LayerAttempt.miss("search-engine", null, "c"))
        );

        resolver.resolve("Embraer", CancellationToken.none());

        assertThat(pauses).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void followsConfiguredOrder() {
        properties.getLayers().setOrder(List.of("search-engine", "website"));
        List<ResolutionLayer> available = List.of(
            new StubLayer("website", name -> LayerAttempt.miss("website", null, "a")),
            new StubLayer("encyclopedia", name -> LayerAttempt.miss("encyclopedia", null, "b")),
            new StubLayer("search-engine", name -> LayerAttempt.miss("search-engine", null, "c"))
        );
        LayeredResolver resolver = new LayeredResolver(available, registryClient, properties, pauses::add);

        assertThat(resolver.layerNames()).containsExactly("search-engine", "website");
    }

    @Test
    void unknownLayerNameFailsFast() {
        properties.getLayers().setOrder(List.of("website", "yellow-pages"));

        List<ResolutionLayer> available = List.of(new StubLayer("website", name -> null));

        assertThatThrownBy(() -> new LayeredResolver(available, registryClient, properties, pauses::add))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("yellow-pages");
    }

    @Test
    void registryLookupSkippedWhenDisabled() {
        properties.getRegistry().setEnabled(false);
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.found("website", List.of(BRANCH, HEAD_OFFICE), null, "Found"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.selected()).isEqualTo(BRANCH);
        verifyNoInteractions(registryClient);
    }

    @Test
    void registryQueriedInDiscoveryOrderUntilMatriz() {
        when(registryClient.lookup(eq(HEAD_OFFICE), any()))
            .thenReturn(Optional.of(new RegistryRecord(HEAD_OFFICE, true, null, null)));
        LayeredResolver resolver = resolver(
            new StubLayer("website", name -> LayerAttempt.found("website", List.of(HEAD_OFFICE, BRANCH), null, "Found"))
        );

        ResolutionResult result = resolver.resolve("Embraer", CancellationToken.none());

        assertThat(result.selected()).isEqualTo(HEAD_OFFICE);
        verify(registryClient).lookup(eq(HEAD_OFFICE), any());
    }

    private LayeredResolver resolver(ResolutionLayer... layers) {
        List<String> names = new ArrayList<>();
        for (ResolutionLayer layer : layers) {
            names.add(layer.name());
        }
        properties.getLayers().setOrder(names);
        return new LayeredResolver(List.of(layers), registryClient, properties, pauses::add);
    }

    private static final class StubLayer implements ResolutionLayer {
        private final String name;
        private final Function<String, LayerAttempt> behaviour;
        private int calls;

        private StubLayer(String name, Function<String, LayerAttempt> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public LayerAttempt attempt(String companyName, CancellationToken token) {
            calls++;
            return behaviour.apply(companyName);
        }
    }
}
