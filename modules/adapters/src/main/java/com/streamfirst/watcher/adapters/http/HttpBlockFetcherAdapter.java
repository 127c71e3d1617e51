package com.streamfirst.watcher.adapters.http;

import com.streamfirst.watcher.domain.BlockMaterial;
import com.streamfirst.watcher.domain.Source;
import com.streamfirst.watcher.ports.BlockFetchException;
import com.streamfirst.watcher.ports.BlockFetcherPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Fetches block files from validator archives. {@code http} and {@code https} archives are
 * read with OkHttp; {@code file} archives, mirrored to local disk, are read directly.
 * Every call is a single attempt and the adapter keeps no per-call state.
 */
@Slf4j
public class HttpBlockFetcherAdapter implements BlockFetcherPort, AutoCloseable {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);

    private final Set<Source> sources;
    private final OkHttpClient client;

    public HttpBlockFetcherAdapter(Collection<Source> sources) {
        this(sources, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public HttpBlockFetcherAdapter(Collection<Source> sources, Duration connectTimeout, Duration readTimeout) {
        this(sources, new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .retryOnConnectionFailure(false)
                .build());
    }

    public HttpBlockFetcherAdapter(Collection<Source> sources, OkHttpClient client) {
        this.sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
        this.client = client;
    }

    @Override
    public Set<Source> getSourceUrls() {
        return sources;
    }

    @Override
    public BlockMaterial fetchBlock(URI blockUrl) throws BlockFetchException {
        String scheme = blockUrl.getScheme() == null ? "" : blockUrl.getScheme().toLowerCase();
        byte[] body = switch (scheme) {
            case "http", "https" -> readHttp(blockUrl);
            case "file" -> readFile(blockUrl);
            default -> throw new BlockFetchException(blockUrl, "Unsupported URL scheme '" + scheme + "'");
        };

        try {
            return BlockMaterialCodec.decode(body);
        } catch (IllegalArgumentException e) {
            throw new BlockFetchException(blockUrl, "Malformed block file", e);
        }
    }

    private byte[] readHttp(URI blockUrl) throws BlockFetchException {
        HttpUrl url = HttpUrl.parse(blockUrl.toString());
        if (url == null) {
            throw new BlockFetchException(blockUrl, "Invalid HTTP URL");
        }
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new BlockFetchException(blockUrl, "HTTP " + response.code());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new BlockFetchException(blockUrl, "Empty response");
            }
            byte[] bytes = responseBody.bytes();
            log.trace("Fetched {} bytes from {}", bytes.length, blockUrl);
            return bytes;
        } catch (IOException e) {
            throw new BlockFetchException(blockUrl, "Request failed", e);
        }
    }

    private byte[] readFile(URI blockUrl) throws BlockFetchException {
        try {
            return Files.readAllBytes(Path.of(blockUrl));
        } catch (NoSuchFileException e) {
            throw new BlockFetchException(blockUrl, "Block file not found", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new BlockFetchException(blockUrl, "Cannot read block file", e);
        }
    }

    /**
     * Releases the HTTP client's threads and pooled connections.
     */
    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
