package work.vernacular.kernel.core;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * HTTP commands over {@link HttpClient}: GET, status and reachability checks, form POST and file download. The
 * timeout comes from the engine settings.
 */
public final class HttpCommands {
    private HttpCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("http/status", "get (?:the )?status of (?:url )?(['\"])(.+?)\\1", HttpCommands::status);
        registry.register("http/check", "check if (?:url )?(['\"])(.+?)\\1 is (?:accessible|available)", HttpCommands::check);
        registry.register("http/get", "get (?:data )?from (?:url )?(['\"])(.+?)\\1", HttpCommands::get);
        registry.register("http/post", "post (?:data )?to (?:url )?(['\"])(.+?)\\1 with data (.+)", HttpCommands::post);
        registry.register("http/download",
            "download (?:file )?from (['\"])(.+?)\\1 (?:to|as) (['\"])(.+?)\\3", HttpCommands::download);
        return registry;
    }

    private static LeafResult get(CommandContext ctx, Matcher m) throws IOException, InterruptedException {
        var response = send(ctx, m.group(2));
        if (response.statusCode() >= 400) {
            throw new CommandFailedException("GET " + m.group(2) + " returned HTTP " + response.statusCode());
        }
        var body = response.body();
        ctx.println(body);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, body);
        return LeafResult.value(body);
    }

    private static LeafResult status(CommandContext ctx, Matcher m) throws IOException, InterruptedException {
        long code = send(ctx, m.group(2)).statusCode();
        ctx.println("Status of " + m.group(2) + ": " + code);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, code);
        return LeafResult.value(code);
    }

    private static LeafResult check(CommandContext ctx, Matcher m) throws InterruptedException {
        boolean reachable;
        try {
            reachable = send(ctx, m.group(2)).statusCode() < 400;
        } catch (IOException ex) {
            ctx.environment().log().debug("line %d: %s unreachable: %s", ctx.lineNumber(), m.group(2), ex.getMessage());
            reachable = false;
        }
        ctx.println("URL " + m.group(2) + " is " + (reachable ? "accessible" : "not accessible"));
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, reachable);
        return LeafResult.value(reachable);
    }

    private static LeafResult post(CommandContext ctx, Matcher m) throws IOException, InterruptedException {
        var form = formData(ctx, m.group(3));
        var body = new StringJoiner("&");
        form.forEach((key, value) -> body.add(
            URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        var request = HttpRequest.newBuilder(uri(m.group(2)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        var response = send(ctx, request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 400) {
            throw new CommandFailedException("POST " + m.group(2) + " returned HTTP " + response.statusCode());
        }
        ctx.println("Status: " + response.statusCode());
        ctx.println(response.body());
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, response.body());
        return LeafResult.value(response.body());
    }

    private static LeafResult download(CommandContext ctx, Matcher m) throws IOException, InterruptedException {
        var response = send(ctx, HttpRequest.newBuilder(uri(m.group(2))).GET(), HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() >= 400) {
            throw new CommandFailedException("Download from " + m.group(2) + " returned HTTP " + response.statusCode());
        }
        var target = ctx.resolvePath(m.group(4));
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.write(target, response.body());
        long size = response.body().length;
        ctx.println("Downloaded " + size + " bytes to '" + m.group(4) + "'");
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, size);
        return LeafResult.value(size);
    }

    /**
     * Parses {@code key=value, key=value}. Values may be quoted text, numbers or variable names.
     */
    private static Map<String, String> formData(CommandContext ctx, String raw) {
        var form = new LinkedHashMap<String, String>();
        for (var pair : Values.splitList(raw)) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new CommandFailedException("Expected key=value in '" + pair + "'");
            }
            var key = pair.substring(0, eq).strip();
            form.put(key, Operands.text(ctx.scopes(), pair.substring(eq + 1)));
        }
        return form;
    }

    private static HttpResponse<String> send(CommandContext ctx, String url) throws IOException, InterruptedException {
        return send(ctx, HttpRequest.newBuilder(uri(url)).GET(), HttpResponse.BodyHandlers.ofString());
    }

    private static <T> HttpResponse<T> send(CommandContext ctx, HttpRequest.Builder request, HttpResponse.BodyHandler<T> handler)
        throws IOException, InterruptedException {
        var timeout = ctx.settings().httpTimeout();
        var client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout)
            .build();
        return client.send(request.timeout(timeout).build(), handler);
    }

    private static URI uri(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new CommandFailedException("Invalid URL '" + url + "'", ex);
        }
        if (uri.getScheme() == null || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
            throw new CommandFailedException("Only http and https URLs are supported: '" + url + "'");
        }
        return uri;
    }
}
