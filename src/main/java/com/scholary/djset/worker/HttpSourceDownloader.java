package com.scholary.djset.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.DoubleConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads a set over HTTP(S) into a local working directory.
 *
 * <p>Progress is reported as a fraction in [0, 1], at most once per percent, and only when the
 * server sends a Content-Length. Cancellation closes the response stream, which unblocks a read in
 * progress.
 */
@Component
public class HttpSourceDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSourceDownloader.class);
  private static final int BUFFER_SIZE = 64 * 1024;
  private static final Pattern FILE_EXTENSION = Pattern.compile("\\.([A-Za-z0-9]{1,5})$");

  private final HttpClient httpClient;
  private final Duration downloadTimeout;

  public HttpSourceDownloader(WorkerProperties properties) {
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.downloadTimeout = properties.downloadTimeout();
  }

  /**
   * Download {@code sourceUrl} into {@code targetDir}.
   *
   * @return the downloaded file
   * @throws WorkerException if the URL is unusable, the server answers with an error, or I/O fails
   * @throws JobCancelledException if the token is cancelled during the download
   */
  public Path download(
      String sourceUrl, Path targetDir, DoubleConsumer onProgress, CancellationToken token) {
    URI uri = toUri(sourceUrl);
    Path target = targetDir.resolve("source" + extensionOf(uri));

    HttpRequest request =
        HttpRequest.newBuilder().uri(uri).timeout(downloadTimeout).GET().build();

    try {
      Files.createDirectories(targetDir);
      LOGGER.info("Downloading set: host={}, target={}", uri.getHost(), target);

      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      if (response.statusCode() / 100 != 2) {
        response.body().close();
        throw new WorkerException(
            String.format(
                "Download failed: %s answered with HTTP %d", uri.getHost(), response.statusCode()));
      }

      long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
      long bytes = copy(response.body(), target, contentLength, onProgress, token);
      token.throwIfCancelled();

      if (bytes == 0) {
        throw new WorkerException("Download failed: " + uri.getHost() + " returned an empty file");
      }
      LOGGER.info("Download completed: bytes={}", bytes);
      return target;

    } catch (IOException e) {
      token.throwIfCancelled();
      throw new WorkerException("Download failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WorkerException("Download interrupted", e);
    }
  }

  private long copy(
      InputStream body,
      Path target,
      long contentLength,
      DoubleConsumer onProgress,
      CancellationToken token)
      throws IOException {

    Runnable abort = () -> closeOnCancel(body);
    token.onCancel(abort);
    try (InputStream in = body;
        OutputStream out = Files.newOutputStream(target)) {
      byte[] buffer = new byte[BUFFER_SIZE];
      long total = 0;
      int lastPercent = -1;
      int read;
      while ((read = in.read(buffer)) != -1) {
        token.throwIfCancelled();
        out.write(buffer, 0, read);
        total += read;
        if (contentLength > 0) {
          int percent = (int) Math.min(100, total * 100 / contentLength);
          if (percent != lastPercent) {
            lastPercent = percent;
            onProgress.accept(percent / 100.0);
          }
        }
      }
      return total;
    } finally {
      token.removeCallback(abort);
    }
  }

  private void closeOnCancel(InputStream body) {
    try {
      body.close();
    } catch (IOException e) {
      LOGGER.debug("Closing download stream on cancel failed: {}", e.getMessage());
    }
  }

  private static URI toUri(String sourceUrl) {
    URI uri;
    try {
      uri = URI.create(sourceUrl.trim());
    } catch (IllegalArgumentException e) {
      throw new WorkerException("Invalid source URL: " + sourceUrl, e);
    }
    String scheme = uri.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new WorkerException("Unsupported source URL scheme: " + scheme);
    }
    return uri;
  }

  static String extensionOf(URI uri) {
    String path = uri.getPath();
    if (path == null) {
      return "";
    }
    Matcher matcher = FILE_EXTENSION.matcher(path);
    return matcher.find() ? "." + matcher.group(1).toLowerCase() : "";
  }
}
