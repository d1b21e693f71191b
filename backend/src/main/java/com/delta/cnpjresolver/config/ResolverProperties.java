package com.delta.cnpjresolver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "resolver")
public class ResolverProperties {
    private static final String DEFAULT_WEBSITE_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private List<String> proxies = new ArrayList<>();
    private Http http = new Http();
    private Website website = new Website();
    private Encyclopedia encyclopedia = new Encyclopedia();
    private SearchEngine searchEngine = new SearchEngine();
    private Registry registry = new Registry();
    private Branches branches = new Branches();
    private Layers layers = new Layers();
    private Batch batch = new Batch();
    private Cli cli = new Cli();

    public List<String> getProxies() {
        return proxies;
    }

    public void setProxies(List<String> proxies) {
        this.proxies = proxies == null ? new ArrayList<>() : new ArrayList<>(proxies);
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Website getWebsite() {
        return website;
    }

    public void setWebsite(Website website) {
        this.website = website;
    }

    public Encyclopedia getEncyclopedia() {
        return encyclopedia;
    }

    public void setEncyclopedia(Encyclopedia encyclopedia) {
        this.encyclopedia = encyclopedia;
    }

    public SearchEngine getSearchEngine() {
        return searchEngine;
    }

    public void setSearchEngine(SearchEngine searchEngine) {
        this.searchEngine = searchEngine;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Branches getBranches() {
        return branches;
    }

    public void setBranches(Branches branches) {
        this.branches = branches;
    }

    public Layers getLayers() {
        return layers;
    }

    public void setLayers(Layers layers) {
        this.layers = layers;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_WEBSITE_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Http {
        private int maxAttempts = 5;
        private int minDelayMs = 1500;
        private int maxDelayMs = 4500;
        private int timeoutSeconds = 15;
        private int minBodyLength = 500;
        private List<String> userAgents = new ArrayList<>(List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Edge/120.0.0.0",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_1 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Mobile/15E148 Safari/604.1",
            "Mozilla/5.0 (iPad; CPU OS 17_1 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Mobile/15E148 Safari/604.1"
        ));
        private List<String> acceptLanguages = new ArrayList<>(List.of(
            "pt-BR,pt;q=0.9,en-US;q=0.8,en;q=0.7",
            "pt-BR,pt;q=0.9",
            "pt-BR;q=0.9,pt;q=0.8,en;q=0.7",
            "pt-BR,en-US;q=0.9,en;q=0.8"
        ));
        private List<String> blockIndicators = new ArrayList<>(List.of(
            "você foi bloqueado",
            "access denied",
            "captcha",
            "cloudflare",
            "security check",
            "blocked"
        ));
        private List<Integer> rotateStatuses = new ArrayList<>(List.of(403, 422, 423, 429, 500, 501, 502, 503, 504));

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(getMinDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMinBodyLength() {
            return Math.max(0, minBodyLength);
        }

        public void setMinBodyLength(int minBodyLength) {
            this.minBodyLength = Math.max(0, minBodyLength);
        }

        public List<String> getUserAgents() {
            return userAgents;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
        }

        public List<String> getAcceptLanguages() {
            return acceptLanguages;
        }

        public void setAcceptLanguages(List<String> acceptLanguages) {
            this.acceptLanguages = acceptLanguages == null ? new ArrayList<>() : new ArrayList<>(acceptLanguages);
        }

        public List<String> getBlockIndicators() {
            return blockIndicators;
        }

        public void setBlockIndicators(List<String> blockIndicators) {
            this.blockIndicators = blockIndicators == null ? new ArrayList<>() : new ArrayList<>(blockIndicators);
        }

        public List<Integer> getRotateStatuses() {
            return rotateStatuses;
        }

        public void setRotateStatuses(List<Integer> rotateStatuses) {
            this.rotateStatuses = rotateStatuses == null ? new ArrayList<>() : new ArrayList<>(rotateStatuses);
        }
    }

    public static class Website {
        private int timeoutSeconds = 10;
        private int pauseMs = 500;
        private String userAgent;
        private String scheme = "https";

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getPauseMs() {
            return Math.max(0, pauseMs);
        }

        public void setPauseMs(int pauseMs) {
            this.pauseMs = Math.max(0, pauseMs);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public String getScheme() {
            return scheme == null || scheme.isBlank() ? "https" : scheme.trim();
        }

        public void setScheme(String scheme) {
            this.scheme = scheme;
        }
    }

    public static class Encyclopedia {
        private String apiUrl = "https://pt.wikipedia.org/w/api.php";
        private String articleBaseUrl = "https://pt.wikipedia.org/wiki/";
        private int timeoutSeconds = 10;
        private int maxAttempts = 2;
        private int pauseMs = 500;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getArticleBaseUrl() {
            return articleBaseUrl;
        }

        public void setArticleBaseUrl(String articleBaseUrl) {
            this.articleBaseUrl = articleBaseUrl;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getPauseMs() {
            return Math.max(0, pauseMs);
        }

        public void setPauseMs(int pauseMs) {
            this.pauseMs = Math.max(0, pauseMs);
        }
    }

    public static class SearchEngine {
        private String apiKey = "";
        private String endpoint = "https://serpapi.com/search";
        private int timeoutSeconds = 10;
        private int maxAttempts = 3;
        private int pauseMs = 1000;
        private int maxOrganicResults = 5;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? "" : apiKey.trim();
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getPauseMs() {
            return Math.max(0, pauseMs);
        }

        public void setPauseMs(int pauseMs) {
            this.pauseMs = Math.max(0, pauseMs);
        }

        public int getMaxOrganicResults() {
            return Math.max(1, maxOrganicResults);
        }

        public void setMaxOrganicResults(int maxOrganicResults) {
            this.maxOrganicResults = Math.max(1, maxOrganicResults);
        }
    }

    public static class Registry {
        private boolean enabled = true;
        private List<String> urlTemplates = new ArrayList<>(List.of(
            "https://publica.cnpj.ws/cnpj/{cnpj}",
            "https://minhareceita.org/{cnpj}"
        ));
        private int timeoutSeconds = 10;
        private int pauseMs = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getUrlTemplates() {
            return urlTemplates;
        }

        public void setUrlTemplates(List<String> urlTemplates) {
            this.urlTemplates = urlTemplates == null ? new ArrayList<>() : new ArrayList<>(urlTemplates);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getPauseMs() {
            return Math.max(0, pauseMs);
        }

        public void setPauseMs(int pauseMs) {
            this.pauseMs = Math.max(0, pauseMs);
        }
    }

    public static class Branches {
        private boolean enabled = true;
        private String directoryBaseUrl = "https://www.diretoriobrasil.net";
        private int maxPages = 100;
        private boolean canonicalizePageUrls = true;
        private List<String> expectedMarkers = new ArrayList<>(List.of("<div class=\"row-list\">", "empresas"));
        private String sourceLabel = "DiretorioBrasil.net";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectoryBaseUrl() {
            return directoryBaseUrl;
        }

        public void setDirectoryBaseUrl(String directoryBaseUrl) {
            this.directoryBaseUrl = directoryBaseUrl;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public boolean isCanonicalizePageUrls() {
            return canonicalizePageUrls;
        }

        public void setCanonicalizePageUrls(boolean canonicalizePageUrls) {
            this.canonicalizePageUrls = canonicalizePageUrls;
        }

        public List<String> getExpectedMarkers() {
            return expectedMarkers;
        }

        public void setExpectedMarkers(List<String> expectedMarkers) {
            this.expectedMarkers = expectedMarkers == null ? new ArrayList<>() : new ArrayList<>(expectedMarkers);
        }

        public String getSourceLabel() {
            return sourceLabel;
        }

        public void setSourceLabel(String sourceLabel) {
            this.sourceLabel = sourceLabel;
        }
    }

    public static class Layers {
        private List<String> order = new ArrayList<>(List.of("website", "encyclopedia", "search-engine"));
        private int interLayerDelayMs = 1000;

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order == null ? new ArrayList<>() : new ArrayList<>(order);
        }

        public int getInterLayerDelayMs() {
            return Math.max(0, interLayerDelayMs);
        }

        public void setInterLayerDelayMs(int interLayerDelayMs) {
            this.interLayerDelayMs = Math.max(0, interLayerDelayMs);
        }
    }

    public static class Batch {
        private String inputCsv = "input/companies.csv";
        private String outputCsv = "data/cnpj_results.csv";
        private int workers = 1;
        private int companyBudgetSeconds = 0;
        private boolean resume = true;

        public String getInputCsv() {
            return inputCsv;
        }

        public void setInputCsv(String inputCsv) {
            this.inputCsv = inputCsv;
        }

        public String getOutputCsv() {
            return outputCsv;
        }

        public void setOutputCsv(String outputCsv) {
            this.outputCsv = outputCsv;
        }

        public int getWorkers() {
            return Math.max(1, workers);
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }

        public int getCompanyBudgetSeconds() {
            return Math.max(0, companyBudgetSeconds);
        }

        public void setCompanyBudgetSeconds(int companyBudgetSeconds) {
            this.companyBudgetSeconds = Math.max(0, companyBudgetSeconds);
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }
    }

    public static class Cli {
        public static final String MODE_RESOLVE = "resolve";
        public static final String MODE_BRANCHES_ONLY = "branches-only";

        private boolean run;
        private boolean exitAfterRun = true;
        private String mode = MODE_RESOLVE;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getMode() {
            return mode == null || mode.isBlank() ? MODE_RESOLVE : mode.trim().toLowerCase(Locale.ROOT);
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }
}
