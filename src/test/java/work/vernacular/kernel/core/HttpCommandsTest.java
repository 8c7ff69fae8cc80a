package work.vernacular.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.vernacular.kernel.support.KernelTestSupport.harness;
import static work.vernacular.kernel.support.KernelTestSupport.script;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpCommandsTest {
    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hello", exchange -> {
            var body = "hi there".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (var out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/echo", exchange -> {
            byte[] received;
            try (var in = exchange.getRequestBody()) {
                received = in.readAllBytes();
            }
            var contentType = exchange.getRequestHeaders().getFirst("Content-Type");
            var body = (exchange.getRequestMethod() + " " + contentType + " " + new String(received, StandardCharsets.UTF_8))
                .getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(201, body.length);
            try (var out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void getStoresBodyInResult() {
        var h = harness().run("get data from url \"" + base + "/hello\"\n");

        assertEquals(List.of("hi there"), h.lines());
        assertEquals("hi there", h.variable("result"));
    }

    @Test
    void statusAndAvailability() {
        var h = harness().run(script(
            "get the status of url \"" + base + "/missing\"",
            "set missingStatus to result",
            "check if \"" + base + "/hello\" is accessible"
        ));

        assertEquals(404L, h.variable("missingStatus"));
        assertEquals(true, h.variable("result"));
    }

    @Test
    void errorStatusAndBadSchemesAreLeafFailures() {
        var h = harness().run(script(
            "get from url \"" + base + "/missing\"",
            "get from url 'ftp://example.invalid/file'",
            "print \"after\""
        ));

        assertEquals(List.of("after"), h.lines());
        assertEquals(2, h.engine().stats().commandsFailed());
    }

    @Test
    void postSendsFormEncodedData() {
        var h = harness().run(script(
            "set who to \"Ada Lovelace\"",
            "post data to url \"" + base + "/echo\" with data name=who, year=1843"
        ));

        var echoed = "POST application/x-www-form-urlencoded name=Ada+Lovelace&year=1843";
        assertEquals(List.of("Status: 201", echoed), h.lines());
        assertEquals(echoed, h.variable("result"));
    }

    @Test
    void postWithoutKeyValuePairsIsALeafFailure() {
        var h = harness().run("post to \"" + base + "/echo\" with data just text\n");

        assertTrue(h.lines().isEmpty());
        assertEquals(1, h.engine().stats().commandsFailed());
    }

    @Test
    void downloadWritesTheResponseBodyToAFile(@TempDir Path workDir) throws Exception {
        var h = harness(workDir).run(script(
            "download file from \"" + base + "/hello\" to \"files/hello.txt\"",
            "download from '" + base + "/missing' as 'gone.txt'"
        ));

        assertEquals(List.of("Downloaded 8 bytes to 'files/hello.txt'"), h.lines());
        assertEquals("hi there", Files.readString(workDir.resolve("files/hello.txt")));
        assertEquals(8L, h.variable("result"));
        assertFalse(Files.exists(workDir.resolve("gone.txt")));
        assertEquals(1, h.engine().stats().commandsFailed());
    }
}
