package org.leafline.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.model.dto.request.ReadingProgressRequest;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@RequiredArgsConstructor
public class RestProgressSink implements ProgressSink {

    static final String PROGRESS_PATH = "/api/v1/library/progress";

    private final RestClient restClient;
    private final Executor executor;

    public static RestProgressSink create(String baseUrl, String userHeader, String username, Executor executor) {
        RestClient client = RestClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(userHeader, username)
                .build();
        return new RestProgressSink(client, executor);
    }

    @Override
    public void save(ReadingProgressRequest request) {
        restClient.post()
                .uri(PROGRESS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    public void saveAsync(ReadingProgressRequest request) {
        CompletableFuture.runAsync(() -> save(request), executor)
                .exceptionally(ex -> {
                    log.debug("Background progress save for book {} failed: {}", request.getBookId(), ex.getMessage());
                    return null;
                });
    }
}
