package org.example.pysolver.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.PackageNotFoundException;
import org.example.pysolver.model.PackageKey;
import org.example.pysolver.requirement.PythonVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Client for the "simple" repository API (PEP 503) spoken by PyPI and compatible indexes.
 *
 * <p>The JSON form of the API (PEP 691, with the PEP 700 {@code versions} key) is
 * requested first; indexes that only serve the HTML form are handled as well. Project
 * pages are cached for the lifetime of the instance.</p>
 */
public class SimpleApiPackageIndex implements PackageIndex {

    private static final Logger log = LoggerFactory.getLogger(SimpleApiPackageIndex.class);

    static final String SIMPLE_JSON_TYPE = "application/vnd.pypi.simple.v1+json";
    private static final String ACCEPT_HEADER = SIMPLE_JSON_TYPE + ", text/html;q=0.1";

    private static final Pattern ANCHOR_PATTERN = Pattern.compile(
            "<a\\s[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHA256_FRAGMENT = Pattern.compile("#sha256=([0-9a-fA-F]{64})");
    private static final List<String> SDIST_EXTENSIONS = List.of(".tar.gz", ".tar.bz2", ".tar.xz", ".tgz", ".zip");

    private final String url;
    private final OkHttpClient httpClient;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final String authorization;
    private final Map<String, ProjectPage> pages = new HashMap<>();

    /**
     * Creates a client with default timeouts and retry settings and no credentials.
     */
    public SimpleApiPackageIndex(String url) {
        this(url, defaultHttpClient(), new RetryExecutor(), null, null);
    }

    /**
     * @param url           index URL, e.g. {@code https://pypi.org/simple}
     * @param httpClient    HTTP client to use
     * @param retryExecutor retry policy for transient failures
     * @param username      basic auth user name (null = anonymous)
     * @param password      basic auth password
     */
    public SimpleApiPackageIndex(String url, OkHttpClient httpClient, RetryExecutor retryExecutor,
                                 String username, String password) {
        this.url = Objects.requireNonNull(url, "url cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.objectMapper = new ObjectMapper();
        this.authorization = username != null && !username.isEmpty()
                ? Credentials.basic(username, password != null ? password : "")
                : null;
    }

    public static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public List<String> getPackageVersions(String packageName) throws IndexException {
        return fetchProject(packageName).versions;
    }

    @Override
    public List<String> getPackageHashes(String packageName, String version) throws IndexException {
        ProjectPage page = fetchProject(packageName);
        Optional<PythonVersion> requested = PythonVersion.tryParse(version);

        List<String> hashes = new ArrayList<>();
        for (IndexFile file : page.files) {
            if (file.sha256 == null || file.version == null) {
                continue;
            }
            if (file.version.equals(version) || sameVersion(requested, file.version)) {
                hashes.add(file.sha256);
            }
        }
        log.debug("Found {} hashes for {}=={} on {}", hashes.size(), packageName, version, url);
        return hashes;
    }

    private static boolean sameVersion(Optional<PythonVersion> requested, String fileVersion) {
        return requested.isPresent() &&
               PythonVersion.tryParse(fileVersion).map(v -> v.equals(requested.get())).orElse(false);
    }

    private ProjectPage fetchProject(String packageName) throws IndexException {
        String normalized = PackageKey.normalizeName(packageName);
        ProjectPage cached = pages.get(normalized);
        if (cached != null) {
            return cached;
        }

        ProjectPage page = retryExecutor.execute(
                () -> requestProject(packageName, normalized),
                "Fetching " + packageName + " from " + url);
        pages.put(normalized, page);
        return page;
    }

    private ProjectPage requestProject(String packageName, String normalized) throws IndexException, IOException {
        String projectUrl = stripTrailingSlash(url) + "/" + normalized + "/";
        Request.Builder request = new Request.Builder()
                .url(projectUrl)
                .header("Accept", ACCEPT_HEADER);
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        log.debug("Querying index: GET {}", projectUrl);
        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (response.code() == 404) {
                throw new PackageNotFoundException(packageName, url);
            }
            if (!response.isSuccessful()) {
                throw new IndexException(
                        "Index " + url + " answered HTTP " + response.code() + " for " + packageName,
                        response.code() >= 500);
            }

            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            String contentType = response.header("Content-Type", "");
            if (contentType.startsWith(SIMPLE_JSON_TYPE) || contentType.startsWith("application/json")) {
                return parseJsonPage(packageName, normalized, content);
            }
            return parseHtmlPage(normalized, content);
        }
    }

    private ProjectPage parseJsonPage(String packageName, String normalized, String content) throws IndexException {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IndexException("Invalid JSON from index " + url + " for " + packageName + ": "
                    + e.getOriginalMessage());
        }

        List<IndexFile> files = new ArrayList<>();
        for (JsonNode file : root.path("files")) {
            String filename = file.path("filename").asText(null);
            if (filename == null) {
                continue;
            }
            String sha256 = file.path("hashes").path("sha256").asText(null);
            files.add(new IndexFile(filename, parseFilenameVersion(normalized, filename), sha256));
        }

        Set<String> versions = new LinkedHashSet<>();
        if (root.has("versions")) {
            for (JsonNode version : root.path("versions")) {
                versions.add(version.asText());
            }
        } else {
            versionsFromFiles(files, versions);
        }
        return new ProjectPage(new ArrayList<>(versions), files);
    }

    private ProjectPage parseHtmlPage(String normalized, String content) {
        List<IndexFile> files = new ArrayList<>();
        Matcher matcher = ANCHOR_PATTERN.matcher(content);
        while (matcher.find()) {
            String href = matcher.group(1);
            String filename = matcher.group(2).trim();
            Matcher hash = SHA256_FRAGMENT.matcher(href);
            String sha256 = hash.find() ? hash.group(1).toLowerCase() : null;
            files.add(new IndexFile(filename, parseFilenameVersion(normalized, filename), sha256));
        }

        Set<String> versions = new LinkedHashSet<>();
        versionsFromFiles(files, versions);
        return new ProjectPage(new ArrayList<>(versions), files);
    }

    private static void versionsFromFiles(List<IndexFile> files, Set<String> versions) {
        versions.addAll(files.stream()
                .map(f -> f.version)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));
    }

    /**
     * Extracts the version from a distribution file name, or null if the name is not
     * a wheel or sdist of the given project.
     */
    static String parseFilenameVersion(String normalizedName, String filename) {
        if (filename.endsWith(".whl")) {
            String[] parts = filename.substring(0, filename.length() - 4).split("-");
            if (parts.length >= 5 && PackageKey.normalizeName(parts[0]).equals(normalizedName)) {
                return parts[1];
            }
            return null;
        }

        String base = null;
        for (String extension : SDIST_EXTENSIONS) {
            if (filename.endsWith(extension)) {
                base = filename.substring(0, filename.length() - extension.length());
                break;
            }
        }
        if (base == null) {
            return null;
        }

        // project names may contain dashes themselves, so try every split point
        int dash = base.indexOf('-');
        while (dash > 0) {
            if (PackageKey.normalizeName(base.substring(0, dash)).equals(normalizedName)) {
                return base.substring(dash + 1);
            }
            dash = base.indexOf('-', dash + 1);
        }
        return null;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return "SimpleApiPackageIndex{" + url + "}";
    }

    private static class ProjectPage {
        private final List<String> versions;
        private final List<IndexFile> files;

        ProjectPage(List<String> versions, List<IndexFile> files) {
            this.versions = List.copyOf(versions);
            this.files = List.copyOf(files);
        }
    }

    private static class IndexFile {
        private final String filename;
        private final String version;
        private final String sha256;

        IndexFile(String filename, String version, String sha256) {
            this.filename = filename;
            this.version = version;
            this.sha256 = sha256;
        }

        @Override
        public String toString() {
            return filename;
        }
    }
}
