package org.example.pysolver.index;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.PackageNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SimpleApiPackageIndex against a mock index server.
 */
class SimpleApiPackageIndexTest {

    private static final String SHA_WHEEL = "a".repeat(64);
    private static final String SHA_SDIST = "b".repeat(64);
    private static final String SHA_OTHER = "c".repeat(64);

    private MockWebServer server;
    private String indexUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        indexUrl = server.url("/simple").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private SimpleApiPackageIndex index(String username, String password) {
        OkHttpClient client = new OkHttpClient.Builder()
                .readTimeout(5, TimeUnit.SECONDS)
                .build();
        return new SimpleApiPackageIndex(indexUrl, client, new RetryExecutor(3, 10), username, password);
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", SimpleApiPackageIndex.SIMPLE_JSON_TYPE)
                .setBody(body);
    }

    private static final String FLASK_JSON = "{"
            + "\"meta\": {\"api-version\": \"1.1\"},"
            + "\"name\": \"flask\","
            + "\"versions\": [\"1.0\", \"2.0.0\", \"2.1.0rc1\"],"
            + "\"files\": ["
            + "  {\"filename\": \"Flask-2.0.0-py3-none-any.whl\", \"hashes\": {\"sha256\": \"" + SHA_WHEEL + "\"}},"
            + "  {\"filename\": \"Flask-2.0.0.tar.gz\", \"hashes\": {\"sha256\": \"" + SHA_SDIST + "\"}},"
            + "  {\"filename\": \"Flask-1.0.tar.gz\", \"hashes\": {\"sha256\": \"" + SHA_OTHER + "\"}}"
            + "]}";

    @Nested
    @DisplayName("JSON API")
    class JsonApi {

        @Test
        @DisplayName("should read versions from the versions key")
        void shouldReadVersions() throws Exception {
            server.enqueue(json(FLASK_JSON));

            List<String> versions = index(null, null).getPackageVersions("Flask");

            assertThat(versions).containsExactly("1.0", "2.0.0", "2.1.0rc1");

            RecordedRequest request = server.takeRequest();
            assertThat(request.getPath()).isEqualTo("/simple/flask/");
            assertThat(request.getHeader("Accept")).startsWith(SimpleApiPackageIndex.SIMPLE_JSON_TYPE);
            assertThat(request.getHeader("Authorization")).isNull();
        }

        @Test
        @DisplayName("should derive versions from file names without versions key")
        void shouldDeriveVersionsFromFiles() throws Exception {
            server.enqueue(json("{\"files\": ["
                    + "{\"filename\": \"six-1.15.0-py2.py3-none-any.whl\", \"hashes\": {}},"
                    + "{\"filename\": \"six-1.16.0.tar.gz\", \"hashes\": {}}"
                    + "]}"));

            assertThat(index(null, null).getPackageVersions("six")).containsExactly("1.15.0", "1.16.0");
        }

        @Test
        @DisplayName("should return hashes of the requested version only")
        void shouldReturnHashesForVersion() throws Exception {
            server.enqueue(json(FLASK_JSON));

            List<String> hashes = index(null, null).getPackageHashes("flask", "2.0");

            assertThat(hashes).containsExactly(SHA_WHEEL, SHA_SDIST);
        }

        @Test
        @DisplayName("should cache project pages")
        void shouldCachePages() throws Exception {
            server.enqueue(json(FLASK_JSON));
            SimpleApiPackageIndex index = index(null, null);

            index.getPackageVersions("flask");
            index.getPackageHashes("Flask", "1.0");

            assertThat(server.getRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should send basic credentials")
        void shouldSendCredentials() throws Exception {
            server.enqueue(json(FLASK_JSON));

            index("deploy", "s3cret").getPackageVersions("flask");

            assertThat(server.takeRequest().getHeader("Authorization")).startsWith("Basic ");
        }

        @Test
        @DisplayName("should fail on malformed JSON")
        void shouldFailOnMalformedJson() {
            server.enqueue(json("{not json"));

            assertThatThrownBy(() -> index(null, null).getPackageVersions("flask"))
                    .isInstanceOf(IndexException.class)
                    .hasMessageContaining("Invalid JSON");
        }
    }

    @Nested
    @DisplayName("HTML API")
    class HtmlApi {

        @Test
        @DisplayName("should parse anchors and hash fragments")
        void shouldParseAnchors() throws Exception {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/html")
                    .setBody("<html><body>"
                            + "<a href=\"../../packages/requests-2.30.0.tar.gz#sha256=" + SHA_SDIST + "\">requests-2.30.0.tar.gz</a>\n"
                            + "<a href=\"../../packages/requests-2.31.0-py3-none-any.whl#sha256=" + SHA_WHEEL + "\">requests-2.31.0-py3-none-any.whl</a>\n"
                            + "</body></html>"));
            SimpleApiPackageIndex index = index(null, null);

            assertThat(index.getPackageVersions("requests")).containsExactly("2.30.0", "2.31.0");
            assertThat(index.getPackageHashes("requests", "2.31.0")).containsExactly(SHA_WHEEL);
        }
    }

    @Nested
    @DisplayName("Error Handling")
    class ErrorHandling {

        @Test
        @DisplayName("should throw PackageNotFoundException on 404")
        void shouldThrowNotFound() {
            server.enqueue(new MockResponse().setResponseCode(404));

            assertThatThrownBy(() -> index(null, null).getPackageVersions("nope"))
                    .isInstanceOf(PackageNotFoundException.class)
                    .hasMessageContaining("nope");
            assertThat(server.getRequestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should retry server errors")
        void shouldRetryServerErrors() throws Exception {
            server.enqueue(new MockResponse().setResponseCode(503));
            server.enqueue(json(FLASK_JSON));

            assertThat(index(null, null).getPackageVersions("flask")).hasSize(3);
            assertThat(server.getRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should not retry client errors")
        void shouldNotRetryClientErrors() {
            server.enqueue(new MockResponse().setResponseCode(401));

            assertThatThrownBy(() -> index(null, null).getPackageVersions("flask"))
                    .isInstanceOf(IndexException.class)
                    .isNotInstanceOf(PackageNotFoundException.class)
                    .hasMessageContaining("401");
            assertThat(server.getRequestCount()).isEqualTo(1);
        }
    }

    @ParameterizedTest
    @CsvSource(value = {
            "zope-interface, zope.interface-5.4.0.tar.gz, 5.4.0",
            "zope-interface, zope_interface-5.4.0-cp39-cp39-manylinux1_x86_64.whl, 5.4.0",
            "python-dateutil, python-dateutil-2.8.2.tar.gz, 2.8.2",
            "six, six-1.16.0.zip, 1.16.0",
            "six, sixer-1.0.tar.gz, NULL",
            "six, six-1.16.0.exe, NULL"
    }, nullValues = "NULL")
    @DisplayName("should parse versions from distribution file names")
    void shouldParseFilenameVersions(String project, String filename, String expected) {
        assertThat(SimpleApiPackageIndex.parseFilenameVersion(project, filename)).isEqualTo(expected);
    }
}
