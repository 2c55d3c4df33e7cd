package com.example.groceryopt.engine;

import com.example.groceryopt.model.PurchasePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs whole optimization requests on worker threads. A request that exceeds its timeout is
 * cancelled and its result discarded; there are no partial plans.
 */
public class AsyncGroceryOptimizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncGroceryOptimizer.class);

    private final GroceryOptimizer optimizer;
    private final ExecutorService executor;

    public AsyncGroceryOptimizer(GroceryOptimizer optimizer, int workers) {
        this.optimizer = optimizer;
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, "grocery-optimizer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Future<PurchasePlan> submit(OptimizationRequest request) {
        return executor.submit(() -> optimizer.optimize(request));
    }

    /**
     * @throws TimeoutException when no plan is ready in time; the request is cancelled
     * @throws ExecutionException wrapping the request's own failure
     */
    public PurchasePlan optimize(OptimizationRequest request, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<PurchasePlan> f = submit(request);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Optimization did not finish within {} ms; discarding it", timeout.toMillis());
            f.cancel(true);
            throw ex;
        } catch (InterruptedException ex) {
            f.cancel(true);
            throw ex;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
