package com.miniomcp.storage.impl;

import com.miniomcp.config.RemoteFetchProperties;
import com.miniomcp.storage.RemoteFetcher;
import com.miniomcp.storage.exception.RemoteFetchException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * 基于 WebClient 的远程下载：响应体直接流式写入临时文件，不在内存中聚合，也不设大小上限。
 * 不跟随重定向，非 2xx 直接失败，不重试。
 */
@Slf4j
@Component
public class WebClientRemoteFetcher implements RemoteFetcher {

    private static final Set<String> FETCHABLE_SCHEMES = Set.of("http", "https");

    private final WebClient webClient;
    private final RemoteFetchProperties props;
    private final SecureRandom random = new SecureRandom();

    public WebClientRemoteFetcher(WebClient.Builder webClientBuilder, RemoteFetchProperties props) {
        this.webClient = webClientBuilder
                .clone()
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .build();
        this.props = props;
    }

    @Override
    public boolean isFetchable(String source) {
        if (!StringUtils.hasText(source)) {
            return false;
        }
        try {
            // 按浏览器（WHATWG）规则宽松解析，未编码的空格等字符不影响协议判断
            String scheme = UriComponentsBuilder
                    .fromUriString(source.trim(), UriComponentsBuilder.ParserType.WHAT_WG)
                    .build()
                    .getScheme();
            return scheme != null && FETCHABLE_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public Mono<Path> fetchToTempFile(String url) {
        return Mono.defer(() -> {
            URI uri;
            try {
                uri = toRequestUri(url.trim());
            } catch (IllegalArgumentException | IllegalStateException e) {
                return Mono.error(new RemoteFetchException("Invalid URL: " + url, e));
            }
            Path temp = newTempPath();
            Duration timeout = props.getTimeout();
            log.debug("[remote-fetch] GET {} -> {} (timeout={})", uri, temp, timeout);

            return webClient.get()
                    .uri(uri)
                    .exchangeToMono(resp -> writeBody(resp, temp))
                    .timeout(timeout, Mono.error(() ->
                            new RemoteFetchException("Download timed out after " + timeout.toMillis() + " ms: " + uri)))
                    .onErrorMap(e -> !(e instanceof RemoteFetchException),
                            e -> new RemoteFetchException("Download failed: " + describe(e), e))
                    .doOnError(e -> {
                        log.debug("[remote-fetch] {} failed: {}", uri, e.getMessage());
                        deleteQuietly(temp);
                    })
                    .doOnCancel(() -> deleteQuietly(temp));
        });
    }

    @Override
    public Mono<Void> discard(Path tempFile) {
        return Mono.fromRunnable(() -> deleteQuietly(tempFile))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private Mono<Path> writeBody(ClientResponse resp, Path temp) {
        HttpStatusCode status = resp.statusCode();
        if (!status.is2xxSuccessful()) {
            return resp.releaseBody()
                    .then(Mono.<Path>error(new RemoteFetchException(
                            "Download failed: " + status.value() + " " + reasonPhrase(status))));
        }
        return DataBufferUtils.write(resp.bodyToFlux(DataBuffer.class), temp,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)
                .thenReturn(temp);
    }

    /**
     * 合法 URI 原样使用（已有的 %xx 不会被二次编码）；否则按组件编码，例如空格变为 %20。
     */
    static URI toRequestUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
        }
    }

    private Path newTempPath() {
        Path dir = StringUtils.hasText(props.getTempDir())
                ? Path.of(props.getTempDir())
                : Path.of(System.getProperty("java.io.tmpdir"));
        byte[] suffix = new byte[16];
        random.nextBytes(suffix);
        return dir.resolve(props.getTempPrefix() + Hex.encodeHexString(suffix));
    }

    private void deleteQuietly(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("[remote-fetch] deleted temp file {}", file);
            }
        } catch (IOException e) {
            log.warn("[remote-fetch] failed to delete temp file {}", file, e);
        }
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "";
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
