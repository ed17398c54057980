package org.luxbulb.webinfo.enricher.asn;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.EnricherConfig;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Properties;

/**
 * Locates the ip2asn table on the disk, downloading it first if it is missing, and loads it.
 */
public class Ip2AsnTableLoader {
    public static final String COMPONENT_NAME = "asn-table-loader";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(Ip2AsnTableLoader.class);

    private final Path _path;
    private final URI _url;
    private final boolean _download;

    public Ip2AsnTableLoader(@NotNull Properties properties) {
        final var configuredPath = properties.getProperty(EnricherConfig.ASN_DB_PATH_CONFIG,
                EnricherConfig.ASN_DB_PATH_DEFAULT);

        _path = configuredPath.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"), EnricherConfig.ASN_DB_FILE_NAME)
                : Path.of(configuredPath);
        _url = URI.create(properties.getProperty(EnricherConfig.ASN_DB_URL_CONFIG,
                EnricherConfig.ASN_DB_URL_DEFAULT));
        _download = Boolean.parseBoolean(properties.getProperty(EnricherConfig.ASN_DB_DOWNLOAD_CONFIG,
                EnricherConfig.ASN_DB_DOWNLOAD_DEFAULT));
    }

    /**
     * Loads the table, downloading it to the configured path if it does not exist yet.
     *
     * @return The loaded table.
     * @throws IOException If the table is missing and cannot be downloaded, or if it cannot be read.
     */
    public Ip2AsnTable load() throws IOException {
        if (!Files.exists(_path)) {
            if (!_download)
                throw new IOException("ASN table not found at " + _path + " and downloading is disabled");

            download();
        } else {
            Logger.debug("Using cached ASN table: {}", _path);
        }

        return Ip2AsnTable.load(_path);
    }

    private void download() throws IOException {
        Logger.info("Downloading ASN table from {} to {}", _url, _path);

        final var client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        final var request = HttpRequest.newBuilder(_url).GET().build();

        final var parent = _path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);

        // Download to a temporary file first so that an interrupted download is not mistaken for the table
        final var tempFile = Files.createTempFile(parent, EnricherConfig.ASN_DB_FILE_NAME, ".part");
        try {
            final var response = client.send(request, HttpResponse.BodyHandlers.ofFile(tempFile));
            if (response.statusCode() != 200)
                throw new IOException("Cannot download the ASN table: HTTP status " + response.statusCode());

            Files.move(tempFile, _path, StandardCopyOption.REPLACE_EXISTING);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("ASN table download interrupted");
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    public Path getPath() {
        return _path;
    }
}
