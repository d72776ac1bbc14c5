package com.whatshouldido.service.suggestion;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 외부 연동(상황/장소/경로) 호출을 전용 스레드 풀에서 데드라인과 함께 실행
 * 타임아웃 시 작업을 취소하고 TimeoutException 을 던진다.
 */
@Slf4j
@Component
public class CollaboratorInvoker {

    private final ExecutorService executorService;

    public CollaboratorInvoker(SuggestionsProperties properties) {
        this.executorService = Executors.newFixedThreadPool(properties.getCollaboratorPoolSize());
    }

    /**
     * @throws TimeoutException   데드라인 초과 (작업은 취소됨)
     * @throws ExecutionException 작업 자체가 실패 (getCause() 가 원인)
     * @throws CancellationException 요청 스레드가 인터럽트됨 (인터럽트 플래그는 다시 설정됨)
     */
    public <T> T call(String collaborator, Supplier<T> task, Duration timeout)
            throws TimeoutException, ExecutionException {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(task, executorService);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[CollaboratorInvoker] {} timed out after {} ms", collaborator, timeout.toMillis());
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(collaborator + " call interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }
}
