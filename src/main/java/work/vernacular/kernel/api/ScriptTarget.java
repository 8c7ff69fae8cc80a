package work.vernacular.kernel.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a script comes from: a local file, an HTTP(S) URL, or inline text.
 */
public record ScriptTarget(Optional<Path> localPath, Optional<URI> remoteUri, Optional<String> inlineSource) {
    public ScriptTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        Objects.requireNonNull(inlineSource, "inlineSource");
        if (localPath.isEmpty() && remoteUri.isEmpty() && inlineSource.isEmpty()) {
            throw new IllegalArgumentException("One of localPath, remoteUri or inlineSource must be present.");
        }
    }

    public static ScriptTarget forLocal(Path path) {
        return new ScriptTarget(Optional.of(path), Optional.empty(), Optional.empty());
    }

    public static ScriptTarget forRemote(URI uri) {
        return new ScriptTarget(Optional.empty(), Optional.of(uri), Optional.empty());
    }

    public static ScriptTarget forInline(String source) {
        return new ScriptTarget(Optional.empty(), Optional.empty(), Optional.of(source));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString)
            .or(() -> remoteUri.map(URI::toString))
            .orElse("<inline>");
    }
}
