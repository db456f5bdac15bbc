package com.sectracker.resolver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lookup")
public class LookupProperties {
    private static final String DEFAULT_USER_AGENT = "sec-tracker contact@example.com";

    private String userAgent;
    private int perHostDelayMs = 100;
    private int requestTimeoutSeconds = 30;
    private Api api = new Api();
    private Registry registry = new Registry();
    private Matching matching = new Matching();
    private Graph graph = new Graph();
    private Generative generative = new Generative();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Graph getGraph() {
        return graph;
    }

    public void setGraph(Graph graph) {
        this.graph = graph;
    }

    public Generative getGenerative() {
        return generative;
    }

    public void setGenerative(Generative generative) {
        this.generative = generative;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class Api {
        private int defaultSearchLimit = 10;
        private int maxSearchLimit = 50;

        public int getDefaultSearchLimit() {
            return Math.max(1, defaultSearchLimit);
        }

        public void setDefaultSearchLimit(int defaultSearchLimit) {
            this.defaultSearchLimit = Math.max(1, defaultSearchLimit);
        }

        public int getMaxSearchLimit() {
            return Math.max(1, maxSearchLimit);
        }

        public void setMaxSearchLimit(int maxSearchLimit) {
            this.maxSearchLimit = Math.max(1, maxSearchLimit);
        }
    }

    public static class Registry {
        private String source = "sec";
        private String secCompanyTickersUrl = "https://www.sec.gov/files/company_tickers.json";
        private String csvPath = "../data/company_tickers.csv";

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getSecCompanyTickersUrl() {
            return secCompanyTickersUrl;
        }

        public void setSecCompanyTickersUrl(String secCompanyTickersUrl) {
            this.secCompanyTickersUrl = secCompanyTickersUrl;
        }

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }
    }

    public static class Matching {
        private double directThreshold = 0.85;
        private double graphThreshold = 0.70;
        private double graphConfidence = 0.90;
        private double generativeConfidence = 0.85;
        private int directLimit = 5;
        private int verifyLimit = 3;
        private double fallbackMinScore = 0.50;

        public double getDirectThreshold() {
            return clampUnit(directThreshold);
        }

        public void setDirectThreshold(double directThreshold) {
            this.directThreshold = clampUnit(directThreshold);
        }

        public double getGraphThreshold() {
            return clampUnit(graphThreshold);
        }

        public void setGraphThreshold(double graphThreshold) {
            this.graphThreshold = clampUnit(graphThreshold);
        }

        public double getGraphConfidence() {
            return clampUnit(graphConfidence);
        }

        public void setGraphConfidence(double graphConfidence) {
            this.graphConfidence = clampUnit(graphConfidence);
        }

        public double getGenerativeConfidence() {
            return clampUnit(generativeConfidence);
        }

        public void setGenerativeConfidence(double generativeConfidence) {
            this.generativeConfidence = clampUnit(generativeConfidence);
        }

        public int getDirectLimit() {
            return Math.max(1, directLimit);
        }

        public void setDirectLimit(int directLimit) {
            this.directLimit = Math.max(1, directLimit);
        }

        public int getVerifyLimit() {
            return Math.max(1, verifyLimit);
        }

        public void setVerifyLimit(int verifyLimit) {
            this.verifyLimit = Math.max(1, verifyLimit);
        }

        public double getFallbackMinScore() {
            return clampUnit(fallbackMinScore);
        }

        public void setFallbackMinScore(double fallbackMinScore) {
            this.fallbackMinScore = fallbackMinScore;
        }
    }

    public static class Graph {
        private String apiUrl = "https://www.wikidata.org/w/api.php";
        private String entityUrl = "https://www.wikidata.org/wiki/Special:EntityData";
        private String language = "en";
        private int searchLimit = 3;
        private int maxDepth = 5;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getEntityUrl() {
            return entityUrl;
        }

        public void setEntityUrl(String entityUrl) {
            this.entityUrl = entityUrl;
        }

        public String getLanguage() {
            return language == null || language.isBlank() ? "en" : language.trim();
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getSearchLimit() {
            return Math.max(1, searchLimit);
        }

        public void setSearchLimit(int searchLimit) {
            this.searchLimit = Math.max(1, searchLimit);
        }

        public int getMaxDepth() {
            return Math.max(1, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(1, maxDepth);
        }
    }

    public static class Generative {
        private boolean enabled = true;
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey = "";
        private String model = "anthropic/claude-3-haiku";
        private int maxTokens = 50;
        private int timeoutSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Cli {
        private boolean run;
        private String queries = "";
        private int concurrency = 4;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getQueries() {
            return queries;
        }

        public void setQueries(String queries) {
            this.queries = queries;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
