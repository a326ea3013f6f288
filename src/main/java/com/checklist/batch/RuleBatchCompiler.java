package com.checklist.batch;

import com.checklist.core.RuleEngine;
import com.checklist.exception.RulesException;
import com.checklist.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles many rule cells on a fixed worker pool.
 * A failing cell yields a failed {@link RuleOutcome}; the other cells are unaffected.
 */
public class RuleBatchCompiler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuleBatchCompiler.class);

    private final RuleEngine engine;
    private final ExecutorService workers;

    public RuleBatchCompiler(RuleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
        int parallelism = engine.getConfig().batch().parallelism();
        this.workers = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        log.info("Created rule batch compiler with {} workers", parallelism);
    }

    /**
     * Compile all cells.
     *
     * @param cells Cells to compile
     * @return One outcome per cell, in input order
     */
    public List<RuleOutcome> compileAll(List<RuleCell> cells) {
        Objects.requireNonNull(cells, "cells");
        if (workers.isShutdown()) {
            throw new IllegalStateException("Batch compiler is closed");
        }

        List<Callable<RuleOutcome>> tasks = new ArrayList<>(cells.size());
        for (RuleCell cell : cells) {
            tasks.add(() -> compile(cell));
        }

        List<RuleOutcome> outcomes = new ArrayList<>(cells.size());
        try {
            List<Future<RuleOutcome>> futures = workers.invokeAll(tasks);
            for (Future<RuleOutcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RulesException("Interrupted while compiling " + cells.size() + " rule cells", e);
        } catch (ExecutionException e) {
            throw new RulesException("Rule compilation failed unexpectedly", e.getCause());
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        log.info("Compiled {} rule cells, {} failed", outcomes.size(), failed);
        return outcomes;
    }

    /**
     * Compile a single cell on the calling thread.
     */
    public RuleOutcome compile(RuleCell cell) {
        try {
            Rule rule = engine.parseRule(cell.text() == null ? "" : cell.text());
            String expression = engine.emitExpression(rule, cell.field());
            return RuleOutcome.success(cell, rule, expression);
        } catch (RulesException e) {
            log.warn("Rule at {} rejected: {}", cell.location(), e.getMessage());
            return RuleOutcome.failure(cell, e);
        }
    }

    public boolean isClosed() {
        return workers.isShutdown();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "rule-compiler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
