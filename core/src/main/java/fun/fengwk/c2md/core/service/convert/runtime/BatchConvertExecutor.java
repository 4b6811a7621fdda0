package fun.fengwk.c2md.core.service.convert.runtime;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.PageConvertService;
import fun.fengwk.c2md.core.service.convert.model.ConvertRequest;
import fun.fengwk.c2md.core.service.convert.model.ConvertResponse;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts independent documents on a fixed worker pool.
 * Every document gets its own conversion context, results keep the request order.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BatchConvertExecutor {

    private final PageConvertService pageConvertService;
    private final ConvertProperties convertProperties;
    private final ExecutorService executor;
    private final AtomicInteger workerIdGen = new AtomicInteger(1);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public BatchConvertExecutor(PageConvertService pageConvertService, ConvertProperties convertProperties) {
        this.pageConvertService = pageConvertService;
        this.convertProperties = convertProperties;
        this.executor = Executors.newFixedThreadPool(Math.max(1, convertProperties.getWorkerThreads()), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("c2md-convert-worker-" + workerIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<ConvertResponse> convertAll(List<ConvertRequest> requests) {
        if (shutdown.get()) {
            throw new IllegalStateException("convert executor is shutdown");
        }
        List<Future<ConvertResponse>> futures = new ArrayList<>(requests.size());
        for (ConvertRequest request : requests) {
            futures.add(executor.submit(() -> pageConvertService.convert(request)));
        }
        List<ConvertResponse> responses = new ArrayList<>(requests.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                responses.add(await(requests.get(i), futures.get(i)));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            log.warn("batch convert interrupted, completed={}, total={}", responses.size(), requests.size());
            throw new IllegalStateException("batch convert interrupted", ex);
        }
        return responses;
    }

    private ConvertResponse await(ConvertRequest request, Future<ConvertResponse> future) throws InterruptedException {
        long timeoutMs = convertProperties.getDocumentTimeoutMs();
        try {
            ConvertResponse response = timeoutMs > 0
                ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                : future.get();
            if (response == null) {
                return failed(request, "convert response is null");
            }
            return response;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("convert timeout, source={}, timeoutMs={}", request.getSourcePath(), timeoutMs);
            return failed(request, "convert timeout after " + timeoutMs + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("convert execution failed, source={}, error={}", request.getSourcePath(), cause.getMessage(), cause);
            return failed(request, cause.getMessage());
        }
    }

    private ConvertResponse failed(ConvertRequest request, String error) {
        return ConvertResponse.builder()
            .statusCode(500)
            .sourcePath(request.getSourcePath())
            .assets(List.of())
            .warnings(List.of())
            .error(error)
            .build();
    }

    @PreDestroy
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            executor.shutdownNow();
            log.info("convert executor shutdown completed");
        }
    }

}
