package com.openaasx.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "OpenAASXIndex/0.1 (+https://github.com/open-aasx-index/open-aasx-index)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 3;
    private String targetExtension = "aasx";
    private RateLimits rateLimits = new RateLimits();
    private Download download = new Download();
    private Storage storage = new Storage();
    private Run run = new Run();
    private Github github = new Github();
    private List<SourceEntry> sources = new ArrayList<>();
    private List<String> allowedDomains = new ArrayList<>();
    private Sitemap sitemap = new Sitemap();
    private CommonCrawl commoncrawl = new CommonCrawl();
    private Verify verify = new Verify();
    private Publish publish = new Publish();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public String getTargetExtension() {
        return targetExtension;
    }

    public void setTargetExtension(String targetExtension) {
        if (targetExtension == null || targetExtension.isBlank()) {
            this.targetExtension = "aasx";
            return;
        }
        String value = targetExtension.trim().toLowerCase(Locale.ROOT);
        this.targetExtension = value.startsWith(".") ? value.substring(1) : value;
    }

    public RateLimits getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(RateLimits rateLimits) {
        this.rateLimits = rateLimits;
    }

    public Download getDownload() {
        return download;
    }

    public void setDownload(Download download) {
        this.download = download;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Github getGithub() {
        return github;
    }

    public void setGithub(Github github) {
        this.github = github;
    }

    public List<SourceEntry> getSources() {
        return sources;
    }

    public void setSources(List<SourceEntry> sources) {
        this.sources = sources == null ? new ArrayList<>() : sources;
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    public void setAllowedDomains(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains == null ? new ArrayList<>() : allowedDomains;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public CommonCrawl getCommoncrawl() {
        return commoncrawl;
    }

    public void setCommoncrawl(CommonCrawl commoncrawl) {
        this.commoncrawl = commoncrawl;
    }

    public Verify getVerify() {
        return verify;
    }

    public void setVerify(Verify verify) {
        this.verify = verify;
    }

    public Publish getPublish() {
        return publish;
    }

    public void setPublish(Publish publish) {
        this.publish = publish;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<String> sourceUrls(String type) {
        List<String> urls = new ArrayList<>();
        for (SourceEntry entry : sources) {
            if (entry != null && entry.getUrl() != null && !entry.getUrl().isBlank()
                && type.equalsIgnoreCase(entry.getType())) {
                urls.add(entry.getUrl().trim());
            }
        }
        return urls;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class RateLimits {
        private double githubRequestsPerMinute = 10;
        private int githubBurst = 10;
        private double webRequestsPerSecond = 1.0;
        private int webBurst = 5;
        private long backoffBaseMs = 1000;
        private long backoffMaxMs = 60_000;
        private double backoffMultiplier = 2.0;

        public double getGithubRequestsPerMinute() {
            return githubRequestsPerMinute > 0 ? githubRequestsPerMinute : 10;
        }

        public void setGithubRequestsPerMinute(double githubRequestsPerMinute) {
            this.githubRequestsPerMinute = githubRequestsPerMinute;
        }

        public int getGithubBurst() {
            return Math.max(1, githubBurst);
        }

        public void setGithubBurst(int githubBurst) {
            this.githubBurst = Math.max(1, githubBurst);
        }

        public double getWebRequestsPerSecond() {
            return webRequestsPerSecond > 0 ? webRequestsPerSecond : 1.0;
        }

        public void setWebRequestsPerSecond(double webRequestsPerSecond) {
            this.webRequestsPerSecond = webRequestsPerSecond;
        }

        public int getWebBurst() {
            return Math.max(1, webBurst);
        }

        public void setWebBurst(int webBurst) {
            this.webBurst = Math.max(1, webBurst);
        }

        public long getBackoffBaseMs() {
            return Math.max(1, backoffBaseMs);
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = Math.max(1, backoffBaseMs);
        }

        public long getBackoffMaxMs() {
            return Math.max(getBackoffBaseMs(), backoffMaxMs);
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier >= 1.0 ? backoffMultiplier : 2.0;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Download {
        private long maxBytes = 50L * 1024 * 1024;
        private long maxUncompressedBytes = 100L * 1024 * 1024;
        private int maxEntries = 500;
        private double maxCompressionRatio = 100;
        private int maxRedirects = 5;
        private int maxPageBytes = 5_000_000;

        public long getMaxBytes() {
            return Math.max(1, maxBytes);
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = Math.max(1, maxBytes);
        }

        public long getMaxUncompressedBytes() {
            return Math.max(1, maxUncompressedBytes);
        }

        public void setMaxUncompressedBytes(long maxUncompressedBytes) {
            this.maxUncompressedBytes = Math.max(1, maxUncompressedBytes);
        }

        public int getMaxEntries() {
            return Math.max(1, maxEntries);
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = Math.max(1, maxEntries);
        }

        public double getMaxCompressionRatio() {
            return maxCompressionRatio > 0 ? maxCompressionRatio : 100;
        }

        public void setMaxCompressionRatio(double maxCompressionRatio) {
            this.maxCompressionRatio = maxCompressionRatio;
        }

        public int getMaxRedirects() {
            return Math.max(0, maxRedirects);
        }

        public void setMaxRedirects(int maxRedirects) {
            this.maxRedirects = Math.max(0, maxRedirects);
        }

        public int getMaxPageBytes() {
            return Math.max(1024, maxPageBytes);
        }

        public void setMaxPageBytes(int maxPageBytes) {
            this.maxPageBytes = Math.max(1024, maxPageBytes);
        }
    }

    public static class Storage {
        private String dataDir = "data";
        private String catalogFile = "catalog.ndjson";
        private String stateFile = "state.json";
        private String reportsDir = "data/reports";
        private String publicDir = "public";
        private String workDir;

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getCatalogFile() {
            return catalogFile;
        }

        public void setCatalogFile(String catalogFile) {
            this.catalogFile = catalogFile;
        }

        public String getStateFile() {
            return stateFile;
        }

        public void setStateFile(String stateFile) {
            this.stateFile = stateFile;
        }

        public String getReportsDir() {
            return reportsDir;
        }

        public void setReportsDir(String reportsDir) {
            this.reportsDir = reportsDir;
        }

        public String getPublicDir() {
            return publicDir;
        }

        public void setPublicDir(String publicDir) {
            this.publicDir = publicDir;
        }

        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public Path catalogPath() {
            return Path.of(dataDir).resolve(catalogFile);
        }

        public Path statePath() {
            return Path.of(dataDir).resolve(stateFile);
        }

        public Path reportsPath() {
            return Path.of(reportsDir);
        }

        public Path publicPath() {
            return Path.of(publicDir);
        }

        public Path workPath() {
            if (workDir == null || workDir.isBlank()) {
                return Path.of(System.getProperty("java.io.tmpdir"));
            }
            return Path.of(workDir);
        }
    }

    public static class Run {
        private int maxValidate = 200;
        private int maxGithub = 100;
        private int maxWeb = 50;
        private int processingConcurrency = 2;
        private int discoveryConcurrency = 4;

        public int getMaxValidate() {
            return Math.max(0, maxValidate);
        }

        public void setMaxValidate(int maxValidate) {
            this.maxValidate = Math.max(0, maxValidate);
        }

        public int getMaxGithub() {
            return Math.max(0, maxGithub);
        }

        public void setMaxGithub(int maxGithub) {
            this.maxGithub = Math.max(0, maxGithub);
        }

        public int getMaxWeb() {
            return Math.max(0, maxWeb);
        }

        public void setMaxWeb(int maxWeb) {
            this.maxWeb = Math.max(0, maxWeb);
        }

        public int getProcessingConcurrency() {
            return Math.max(1, processingConcurrency);
        }

        public void setProcessingConcurrency(int processingConcurrency) {
            this.processingConcurrency = Math.max(1, processingConcurrency);
        }

        public int getDiscoveryConcurrency() {
            return Math.max(1, discoveryConcurrency);
        }

        public void setDiscoveryConcurrency(int discoveryConcurrency) {
            this.discoveryConcurrency = Math.max(1, discoveryConcurrency);
        }
    }

    public static class Github {
        private String apiBaseUrl = "https://api.github.com";
        private String rawBaseUrl = "https://raw.githubusercontent.com";
        private String token;
        private List<String> topics = new ArrayList<>(List.of("aasx", "aas", "asset-administration-shell"));
        private int perPage = 30;
        private int repoSearchPerPage = 100;

        public String getApiBaseUrl() {
            return stripTrailingSlash(apiBaseUrl);
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getRawBaseUrl() {
            return stripTrailingSlash(rawBaseUrl);
        }

        public void setRawBaseUrl(String rawBaseUrl) {
            this.rawBaseUrl = rawBaseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }

        public List<String> getTopics() {
            return topics;
        }

        public void setTopics(List<String> topics) {
            this.topics = topics == null ? new ArrayList<>() : topics;
        }

        public int getPerPage() {
            return Math.min(100, Math.max(1, perPage));
        }

        public void setPerPage(int perPage) {
            this.perPage = perPage;
        }

        public int getRepoSearchPerPage() {
            return Math.min(100, Math.max(1, repoSearchPerPage));
        }

        public void setRepoSearchPerPage(int repoSearchPerPage) {
            this.repoSearchPerPage = repoSearchPerPage;
        }
    }

    public static class SourceEntry {
        private String url;
        private String name;
        private String type = "seed";
        private String notes;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getNotes() {
            return notes;
        }

        public void setNotes(String notes) {
            this.notes = notes;
        }
    }

    public static class Sitemap {
        private int maxDepth = 2;
        private int maxNestedSitemaps = 5;
        private int maxPagesPerSite = 20;
        private boolean respectRobots = true;
        private List<String> commonPaths = new ArrayList<>(List.of("/sitemap.xml", "/sitemap_index.xml", "/sitemap/sitemap.xml"));
        private List<String> keywords = new ArrayList<>(List.of("aasx", "aas", "asset-administration", "digital-twin", "sample", "download"));

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getMaxNestedSitemaps() {
            return Math.max(1, maxNestedSitemaps);
        }

        public void setMaxNestedSitemaps(int maxNestedSitemaps) {
            this.maxNestedSitemaps = Math.max(1, maxNestedSitemaps);
        }

        public int getMaxPagesPerSite() {
            return Math.max(1, maxPagesPerSite);
        }

        public void setMaxPagesPerSite(int maxPagesPerSite) {
            this.maxPagesPerSite = Math.max(1, maxPagesPerSite);
        }

        public boolean isRespectRobots() {
            return respectRobots;
        }

        public void setRespectRobots(boolean respectRobots) {
            this.respectRobots = respectRobots;
        }

        public List<String> getCommonPaths() {
            return commonPaths;
        }

        public void setCommonPaths(List<String> commonPaths) {
            this.commonPaths = commonPaths == null ? new ArrayList<>() : commonPaths;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : keywords;
        }
    }

    public static class CommonCrawl {
        private String indexUrl = "https://index.commoncrawl.org/CC-MAIN-2024-10-index";
        private String urlPattern = "*.aasx";
        private String matchType = "domain";
        private int maxLimit = 200;

        public String getIndexUrl() {
            return indexUrl;
        }

        public void setIndexUrl(String indexUrl) {
            this.indexUrl = indexUrl;
        }

        public String getUrlPattern() {
            return urlPattern;
        }

        public void setUrlPattern(String urlPattern) {
            this.urlPattern = urlPattern;
        }

        public String getMatchType() {
            return matchType;
        }

        public void setMatchType(String matchType) {
            this.matchType = matchType;
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }

    public static class Verify {
        private List<String> command = new ArrayList<>(List.of(
            "python3", "-m", "aas_test_engines", "check_file", "{file}", "--format", "aasx", "--output", "json"
        ));
        private String engine = "aas-test-engines";
        private int timeoutSeconds = 120;
        private boolean saveReports = true;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command == null ? new ArrayList<>() : command;
        }

        public String getEngine() {
            return engine;
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public boolean isSaveReports() {
            return saveReports;
        }

        public void setSaveReports(boolean saveReports) {
            this.saveReports = saveReports;
        }
    }

    public static class Publish {
        private boolean enabled = true;
        private int topSemanticIds = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTopSemanticIds() {
            return Math.max(1, topSemanticIds);
        }

        public void setTopSemanticIds(int topSemanticIds) {
            this.topSemanticIds = Math.max(1, topSemanticIds);
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

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
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
