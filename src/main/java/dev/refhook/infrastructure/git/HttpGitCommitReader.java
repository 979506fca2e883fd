package dev.refhook.infrastructure.git;

import dev.refhook.config.GitProperties;
import dev.refhook.domain.valueobject.Commit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Git data accessor over the git service's REST API.
 * Uses WebClient with .block(): callers are event listener threads, never an event loop.
 */
@Component
public class HttpGitCommitReader implements GitCommitReader {
    private static final Logger log = LoggerFactory.getLogger(HttpGitCommitReader.class);
    private final WebClient webClient;
    private final Duration timeout;

    public HttpGitCommitReader(WebClient.Builder builder, GitProperties properties) {
        this.timeout = properties.timeout();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.timeout())
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = builder.baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE).build();
    }

    @Override
    public Optional<Commit> findCommit(String repoGitUid, String sha) {
        try {
            Commit commit = webClient.get()
                    .uri("/repos/{gitUid}/commits/{sha}", repoGitUid, sha)
                    .retrieve()
                    .bodyToMono(Commit.class)
                    .block(timeout);
            return Optional.ofNullable(commit);
        } catch (WebClientResponseException.NotFound e) {
            log.debug("Commit {} not found in {}", sha, repoGitUid);
            return Optional.empty();
        }
    }
}
