package work.vernacular.kernel.api;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads script source text from a {@link ScriptTarget}.
 */
public final class ScriptLoader {
    private ScriptLoader() {}

    public static String load(ScriptTarget target, Duration timeout) {
        if (target.inlineSource().isPresent()) {
            return target.inlineSource().get();
        }
        return target.remoteUri()
            .map(uri -> loadFromHttp(uri, timeout))
            .orElseGet(() -> loadFromLocalFile(target.localPath().orElseThrow()));
    }

    public static String loadFromLocalFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read script: " + path, ex);
        }
    }

    public static String loadFromHttp(URI uri, Duration timeout) {
        try {
            var client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
            var request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 400) {
                throw new IllegalStateException("HTTP " + response.statusCode() + " while downloading script: " + uri);
            }
            return response.body();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to download script: " + uri, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while downloading script: " + uri, ex);
        }
    }
}
