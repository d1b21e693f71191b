package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.model.FailureKind;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.FetchStatus;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.delta.cnpjresolver.resolve.model.PageFetchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebsiteLayerTest {
    @Mock
    private AntiBlockingHttpClient httpClient;

    private final List<Duration> pauses = new ArrayList<>();
    private WebsiteLayer layer;

    @BeforeEach
    void setUp() {
        layer = new WebsiteLayer(httpClient, new ResolverProperties(), pauses::add);
    }

    @Test
    void generatesDomainCandidatesInOrder() {
        assertThat(WebsiteLayer.domainCandidates("Embraer S.A.")).containsExactly(
            "embraer.com.br",
            "embraer.com",
            "embraer.br",
            "www.embraer.com.br",
            "www.embraer.com"
        );
        assertThat(WebsiteLayer.domainCandidates("S.A.")).isEmpty();
    }

    @Test
    void readsVisibleTextOfFirstReachableSite() {
        when(httpClient.fetch(eq("https://embraer.com.br"), any(FetchProfile.class), any()))
            .thenReturn(unavailable("https://embraer.com.br"));
        when(httpClient.fetch(eq("https://embraer.com"), any(FetchProfile.class), any()))
            .thenReturn(ok("https://embraer.com", """
                <html><head><style>.cnpj{content:"33.683.000/0001-92"}</style></head>
                <body><script>var id = "60.746.148/0001-00";</script>
                <footer>Embraer S.A. CNPJ 07.689.002/0001-89</footer></body></html>
                """));

        LayerAttempt attempt = layer.attempt("Embraer S.A.", CancellationToken.none());

        assertThat(attempt.hasCandidates()).isTrue();
        assertThat(attempt.candidates()).extracting(cnpj -> cnpj.formatted()).containsExactly("07.689.002/0001-89");
        assertThat(attempt.sourceUrl()).isEqualTo("https://embraer.com");
        assertThat(attempt.note()).isEqualTo("Found on website https://embraer.com");
        assertThat(pauses).containsExactly(Duration.ofMillis(500));
        verify(httpClient, never()).fetch(eq("https://embraer.br"), any(FetchProfile.class), any());
    }

    @Test
    void reportsUnavailableWhenNoDomainAnswers() {
        when(httpClient.fetch(anyString(), any(FetchProfile.class), any()))
            .thenAnswer(invocation -> unavailable(invocation.getArgument(0)));

        LayerAttempt attempt = layer.attempt("Embraer S.A.", CancellationToken.none());

        assertThat(attempt.hasCandidates()).isFalse();
        assertThat(attempt.completed()).isTrue();
        assertThat(attempt.failure()).isEqualTo(FailureKind.SOURCE_UNAVAILABLE);
        verify(httpClient, times(5)).fetch(anyString(), any(FetchProfile.class), any());
    }

    @Test
    void reportsParseMissWhenSitesHaveNoIdentifier() {
        when(httpClient.fetch(anyString(), any(FetchProfile.class), any()))
            .thenAnswer(invocation -> ok(invocation.getArgument(0), "<html><body>Bem-vindo</body></html>"));

        LayerAttempt attempt = layer.attempt("Embraer S.A.", CancellationToken.none());

        assertThat(attempt.failure()).isEqualTo(FailureKind.PARSE_MISS);
        assertThat(attempt.note()).isEqualTo("No CNPJ on website");
    }

    private static FetchResult ok(String url, String body) {
        PageFetchOutcome outcome = new PageFetchOutcome(url, 200, body, FetchStatus.OK, null, Duration.ofMillis(3), "ok");
        return new FetchResult(url, outcome, List.of(outcome), false);
    }

    private static FetchResult unavailable(String url) {
        PageFetchOutcome outcome = new PageFetchOutcome(url, 0, null, FetchStatus.TRANSIENT_ERROR, null, Duration.ofMillis(3), "dns_failure");
        return new FetchResult(url, null, List.of(outcome), false);
    }
}
