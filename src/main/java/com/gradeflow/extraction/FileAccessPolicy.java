package com.gradeflow.extraction;

import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which submission files may be read: local paths under one root directory and
 * downloads from listed hosts only.
 */
public class FileAccessPolicy {
    public static final String ANY_HOST = "*";

    private final Path allowedRoot;
    private final Set<String> allowedHosts;

    /**
     * @param allowedRoot  directory local files must sit under; {@code null} allows any path
     * @param allowedHosts hosts remote files may come from; {@value #ANY_HOST} allows any host, empty allows none
     */
    public FileAccessPolicy(Path allowedRoot, List<String> allowedHosts) {
        this.allowedRoot = allowedRoot != null ? allowedRoot.toAbsolutePath().normalize() : null;
        this.allowedHosts = allowedHosts.stream()
                .map(host -> host.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static FileAccessPolicy unrestricted() {
        return new FileAccessPolicy(null, List.of(ANY_HOST));
    }

    /**
     * @return the absolute, normalized path of {@code location}
     * @throws ExtractionException if the path is invalid or resolves outside the allowed root
     */
    public Path checkLocal(String location) throws ExtractionException {
        Path path;
        try {
            path = Paths.get(location).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ExtractionException("Invalid path: " + location, e);
        }
        if (allowedRoot == null) {
            return path;
        }
        if (!path.startsWith(allowedRoot)) {
            throw new ExtractionException("File is outside the submissions directory");
        }
        if (Files.exists(path)) {
            // symlinks must not lead out of the root either
            try {
                if (!path.toRealPath().startsWith(allowedRoot.toRealPath())) {
                    throw new ExtractionException("File is outside the submissions directory");
                }
            } catch (IOException e) {
                throw new ExtractionException("Could not resolve " + path.getFileName() + ": " + e.getMessage(), e);
            }
        }
        return path;
    }

    /**
     * @throws ExtractionException if the URL is malformed or its host is not allowed
     */
    public HttpUrl checkRemote(String location) throws ExtractionException {
        HttpUrl url = HttpUrl.parse(location);
        if (url == null) {
            throw new ExtractionException("Invalid URL: " + location);
        }
        if (!allowedHosts.contains(ANY_HOST) && !allowedHosts.contains(url.host().toLowerCase(Locale.ROOT))) {
            throw new ExtractionException("Downloads from host " + url.host() + " are not allowed");
        }
        return url;
    }

    public Path getAllowedRoot() {
        return allowedRoot;
    }

    public Set<String> getAllowedHosts() {
        return allowedHosts;
    }
}
