package dev.resumescreener.fetch;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Downloads resumes over HTTP, resolving Google Drive share links first.
 */
@Slf4j
@Service
public class HttpResumeFetcher implements ResumeFetcher {

    static final String DEFAULT_FILENAME = "resume.pdf";

    private final WebClient webClient;

    public HttpResumeFetcher(WebClient.Builder webClientBuilder, ScreeningConfig config) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(config.getFetch().getMaxBytes()))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", "resume-screener/1.0")
                .defaultHeader("Accept", "*/*")
                .build();
    }

    @Override
    public Mono<FetchedResume> fetch(String locator) {
        String url = DriveLocatorResolver.resolve(locator).orElse(null);
        if (url == null) {
            return Mono.error(new ScreeningException(ErrorKind.LOCATOR_INVALID,
                    "Could not interpret resume locator: " + locator));
        }

        log.debug("Downloading resume from {}", url);
        return webClient.get()
                .uri(url)
                .retrieve()
                .toEntity(byte[].class)
                .flatMap(entity -> toResume(url, entity))
                .onErrorMap(e -> !(e instanceof ScreeningException), e -> classify(url, e));
    }

    private Mono<FetchedResume> toResume(String url, ResponseEntity<byte[]> entity) {
        byte[] body = entity.getBody();
        if (body == null || body.length == 0) {
            return Mono.error(new ScreeningException(ErrorKind.FETCH_NOT_FOUND, "Empty resume download from " + url));
        }
        String filename = resolveFilename(url, entity.getHeaders());
        log.debug("Downloaded {} ({} bytes)", filename, body.length);
        return Mono.just(new FetchedResume(body, filename));
    }

    private ScreeningException classify(String url, Throwable error) {
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 401 || status == 403) {
                return new ScreeningException(ErrorKind.FETCH_ACCESS_DENIED,
                        "Access denied (HTTP " + status + ") for " + url, error);
            }
            if (status == 404 || status == 410) {
                return new ScreeningException(ErrorKind.FETCH_NOT_FOUND,
                        "Resume not found (HTTP " + status + ") at " + url, error);
            }
            if (status == 408 || status == 504) {
                return new ScreeningException(ErrorKind.FETCH_TIMEOUT,
                        "Storage provider timed out (HTTP " + status + ") for " + url, error);
            }
            if (response.getStatusCode().is4xxClientError()) {
                return new ScreeningException(ErrorKind.LOCATOR_INVALID,
                        "Resume link rejected (HTTP " + status + "): " + url, error);
            }
            return new ScreeningException(ErrorKind.PROCESSING_FAILED,
                    "Storage provider error (HTTP " + status + ") for " + url, error);
        }
        if (error instanceof WebClientRequestException request) {
            Throwable cause = request.getRootCause();
            if (cause instanceof ReadTimeoutException || cause instanceof ConnectTimeoutException) {
                return new ScreeningException(ErrorKind.FETCH_TIMEOUT, "Timed out downloading " + url, error);
            }
            if (cause instanceof UnknownHostException) {
                return new ScreeningException(ErrorKind.FETCH_NOT_FOUND, "Unknown host for " + url, error);
            }
            return new ScreeningException(ErrorKind.FETCH_NOT_FOUND,
                    "Failed to download resume from " + url + ": " + error.getMessage(), error);
        }
        if (error instanceof DataBufferLimitException) {
            return new ScreeningException(ErrorKind.PROCESSING_FAILED, "Resume exceeds maximum size: " + url, error);
        }
        return new ScreeningException(ErrorKind.PROCESSING_FAILED,
                "Unexpected download failure for " + url + ": " + error.getMessage(), error);
    }

    /**
     * Content-Disposition filename, else the last URL path segment with an extension,
     * else a name derived from the content type.
     */
    static String resolveFilename(String url, HttpHeaders headers) {
        ContentDisposition disposition = headers.getContentDisposition();
        if (disposition.getFilename() != null && !disposition.getFilename().isBlank()) {
            return disposition.getFilename();
        }

        String path = pathOf(url);
        if (path != null) {
            String segment = path.substring(path.lastIndexOf('/') + 1);
            if (segment.contains(".") && !segment.endsWith(".")) {
                return segment;
            }
        }

        MediaType contentType = headers.getContentType();
        if (contentType != null) {
            String subtype = contentType.getSubtype().toLowerCase();
            if (subtype.contains("wordprocessingml")) {
                return "resume.docx";
            }
            if (subtype.equals("html")) {
                return "resume.html";
            }
            if (contentType.getType().equals("text")) {
                return "resume.txt";
            }
        }
        return DEFAULT_FILENAME;
    }

    private static String pathOf(String url) {
        try {
            return URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
