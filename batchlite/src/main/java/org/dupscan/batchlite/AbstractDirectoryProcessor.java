/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dupscan.batchlite;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one crawler, the processors returned by {@link #getProcessors}
 * and a single consumer, each on its own thread.
 * <p>
 * The crawler feeds the job queue; processors drain it and feed the
 * consumer.  The consumer's stream is closed only once the crawler and
 * every processor have completed.  The first task to fail stops
 * everything else: the shared stop flag is raised and the pool is
 * interrupted.
 */
public abstract class AbstractDirectoryProcessor<R> {

    private static Logger LOGGER = LoggerFactory.getLogger(AbstractDirectoryProcessor.class);

    private static final long TERMINATION_SECONDS = 30;

    public abstract List<AbstractFileProcessor<R>> getProcessors(BlockingQueue<Path> queue,
                                                                 AbstractResultConsumer<R> consumer,
                                                                 AtomicBoolean stopped);

    /**
     * Turns a crawl failure into a result for the consumer.
     *
     * @param path directory or entry that could not be read
     */
    protected abstract R traversalFailed(Path path, IOException e);

    /**
     * @return the number of results the consumer took
     * @throws ExecutionException wrapping the first failure of any task,
     * including the consumer rejecting a result
     */
    public int execute(Path root, AbstractResultConsumer<R> consumer)
            throws ExecutionException, InterruptedException {
        BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
        AtomicBoolean stopped = new AtomicBoolean(false);

        List<AbstractFileProcessor<R>> processors = getProcessors(queue, consumer, stopped);
        if (processors.isEmpty()) {
            throw new IllegalStateException("need at least one processor");
        }
        DirectoryCrawler<R> crawler = new DirectoryCrawler<>(root, queue, processors.size(),
                consumer, this::traversalFailed, stopped);

        int producers = processors.size() + 1;
        ExecutorService executorService = Executors.newFixedThreadPool(producers + 1);
        ExecutorCompletionService<Integer> executorCompletionService =
                new ExecutorCompletionService<>(executorService);

        long start = System.currentTimeMillis();
        Future<Integer> consumerFuture = executorCompletionService.submit(consumer);
        executorCompletionService.submit(crawler);
        for (AbstractFileProcessor<R> processor : processors) {
            executorCompletionService.submit(processor);
        }

        int completed = 0;
        int consumed;
        try {
            while (true) {
                Future<Integer> future = executorCompletionService.take();
                Integer value = future.get();
                if (future == consumerFuture) {
                    consumed = value;
                    break;
                }
                if (++completed == producers) {
                    consumer.shutdown();
                }
            }
        } finally {
            stopped.set(true);
            executorService.shutdownNow();
            awaitTermination(executorService);
        }
        long elapsed = System.currentTimeMillis() - start;
        LOGGER.info("Finished adding " + crawler.getAdded() + " files to the queue;" +
                " and consumed " + consumed + " records in " + elapsed + " ms.");
        return consumed;
    }

    private static void awaitTermination(ExecutorService executorService) {
        try {
            if (!executorService.awaitTermination(TERMINATION_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("tasks still running after {} seconds", TERMINATION_SECONDS);
            }
        } catch (InterruptedException e) {
            LOGGER.warn("interrupted waiting for tasks to stop");
            Thread.currentThread().interrupt();
        }
    }
}
