package com.scholary.mp3.converter.download;

import com.scholary.mp3.converter.config.ConversionProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches media from a plain http(s) URL that isn't a known platform.
 *
 * <p>The body is streamed to a scratch file, never held in memory. Redirects are followed.
 */
@Component
public class DirectDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(DirectDownloader.class);

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

  private final HttpClient httpClient;
  private final Duration requestTimeout;

  public DirectDownloader(ConversionProperties properties) {
    this.requestTimeout = properties.directDownloadTimeout();
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Download a URL to a file.
   *
   * @param url absolute http(s) URL
   * @param target destination file, overwritten
   * @return the target path
   * @throws DirectDownloadException on a non-2xx status, an empty body or any I/O failure
   */
  public Path download(String url, Path target) {
    LOGGER.info("Downloading direct media {} to {}", url, target.getFileName());
    long start = System.currentTimeMillis();

    HttpResponse<Path> response;
    try {
      HttpRequest request =
          HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout).GET().build();
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
    } catch (IllegalArgumentException e) {
      throw new DirectDownloadException("Invalid URL: " + url, e);
    } catch (IOException e) {
      deleteQuietly(target);
      throw new DirectDownloadException("Download failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(target);
      throw new DirectDownloadException("Download interrupted", e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      deleteQuietly(target);
      throw new DirectDownloadException(
          String.format("Download returned HTTP %d for %s", status, url));
    }

    long size;
    try {
      size = Files.size(target);
    } catch (IOException e) {
      throw new DirectDownloadException("Downloaded file unreadable: " + e.getMessage(), e);
    }
    if (size == 0) {
      deleteQuietly(target);
      throw new DirectDownloadException("Download returned an empty body for " + url);
    }

    LOGGER.info("Downloaded {} bytes in {}ms", size, System.currentTimeMillis() - start);
    return target;
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Could not delete {}: {}", file, e.getMessage());
    }
  }
}
