package com.gradeflow.extraction;

import com.gradeflow.models.FileReference;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Makes a submission file available on local disk: remote files are downloaded to a temporary
 * file, local paths are used in place. Both go through a {@link FileAccessPolicy}.
 */
public class FileFetcher {
    private static final Logger logger = LoggerFactory.getLogger(FileFetcher.class);

    public static final long DEFAULT_MAX_DOWNLOAD_BYTES = 10L * 1024 * 1024;

    private final OkHttpClient httpClient;
    private final Path tempDirectory;
    private final FileAccessPolicy policy;
    private final long maxDownloadBytes;

    public FileFetcher() {
        this(FileAccessPolicy.unrestricted(), DEFAULT_MAX_DOWNLOAD_BYTES);
    }

    public FileFetcher(FileAccessPolicy policy, long maxDownloadBytes) {
        this(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .build(), null, policy, maxDownloadBytes);
    }

    /**
     * @param tempDirectory where downloads go; {@code null} for the system default
     */
    public FileFetcher(OkHttpClient httpClient, Path tempDirectory) {
        this(httpClient, tempDirectory, FileAccessPolicy.unrestricted(), DEFAULT_MAX_DOWNLOAD_BYTES);
    }

    public FileFetcher(OkHttpClient httpClient, Path tempDirectory, FileAccessPolicy policy, long maxDownloadBytes) {
        if (maxDownloadBytes < 1) {
            throw new IllegalArgumentException("maxDownloadBytes must be positive: " + maxDownloadBytes);
        }
        this.httpClient = httpClient;
        this.tempDirectory = tempDirectory;
        this.policy = policy;
        this.maxDownloadBytes = maxDownloadBytes;
    }

    public FetchedFile fetch(FileReference reference) throws ExtractionException {
        if (reference.location() == null || reference.location().isBlank()) {
            throw new ExtractionException("File " + reference.name() + " has no location");
        }
        return reference.isRemote() ? download(reference) : local(reference);
    }

    private FetchedFile local(FileReference reference) throws ExtractionException {
        Path path = policy.checkLocal(reference.location());
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ExtractionException("File not found or unreadable: " + displayName(reference));
        }
        return FetchedFile.local(displayName(reference), path);
    }

    private FetchedFile download(FileReference reference) throws ExtractionException {
        HttpUrl url = policy.checkRemote(reference.location());
        String extension = reference.extension();
        String suffix = extension.isEmpty() ? ".tmp" : "." + extension;
        Request request = new Request.Builder().url(url).get().build();

        Path target = null;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ExtractionException("Download failed with HTTP " + response.code() + ": " + reference.location());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new ExtractionException("Empty download: " + reference.location());
            }
            if (body.contentLength() > maxDownloadBytes) {
                throw new ExtractionException("Download too large: " + body.contentLength() + " bytes");
            }
            target = tempDirectory != null
                    ? Files.createTempFile(tempDirectory, "gradeflow-", suffix)
                    : Files.createTempFile("gradeflow-", suffix);
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(target)) {
                copyBounded(in, out);
            }
            logger.debug("Downloaded {} to {}", reference.location(), target);
            return FetchedFile.temporary(displayName(reference), target);
        } catch (IOException | IllegalArgumentException e) {
            deleteQuietly(target);
            throw new ExtractionException("Download failed: " + reference.location() + ": " + e.getMessage(), e);
        } catch (ExtractionException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    /**
     * Copies at most {@code maxDownloadBytes}; servers may omit or understate Content-Length
     */
    private void copyBounded(InputStream in, OutputStream out) throws IOException, ExtractionException {
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxDownloadBytes) {
                throw new ExtractionException("Download too large: more than " + maxDownloadBytes + " bytes");
            }
            out.write(buffer, 0, read);
        }
    }

    private static String displayName(FileReference reference) {
        return reference.name() != null && !reference.name().isBlank() ? reference.name() : reference.location();
    }

    private static void deleteQuietly(Path path) {
        if (path != null) {
            FetchedFile.temporary(path.getFileName().toString(), path).close();
        }
    }
}
