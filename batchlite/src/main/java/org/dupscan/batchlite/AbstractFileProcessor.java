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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker that pulls paths off the shared job queue and hands exactly
 * one result per path to the consumer.  Returns the number of paths it
 * processed.
 */
public abstract class AbstractFileProcessor<R> implements Callable<Integer> {

    /**
     * Marks the end of the job queue; compared by identity.
     * The crawler adds one per worker.
     */
    static final Path POISON = Paths.get("");

    private static final long POLL_MILLIS = 500;

    private static AtomicInteger THREAD_COUNT = new AtomicInteger();

    private static Logger LOGGER = LoggerFactory.getLogger(AbstractFileProcessor.class);

    private final BlockingQueue<Path> queue;
    private final AbstractResultConsumer<R> consumer;
    private final AtomicBoolean stopped;
    private final int id;

    public AbstractFileProcessor(BlockingQueue<Path> queue, AbstractResultConsumer<R> consumer,
                                 AtomicBoolean stopped) {
        this.id = THREAD_COUNT.getAndIncrement();
        this.queue = queue;
        this.consumer = consumer;
        this.stopped = stopped;
    }

    /**
     * Must not throw for a bad file; failures are reported as a result.
     */
    protected abstract R process(Path path);

    @Override
    public Integer call() {
        int processed = 0;
        while (!stopped.get() && !Thread.currentThread().isInterrupted()) {
            Path path;
            try {
                path = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                return processed;
            }
            if (path == null) {
                continue;
            } else if (path == POISON) {
                LOGGER.debug("processor ({}) finished after {} files", id, processed);
                return processed;
            }
            long start = System.currentTimeMillis();
            R result = process(path);
            try {
                consumer.put(result);
            } catch (InterruptedException e) {
                return processed;
            }
            processed++;
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("processor ({}) took {} ms to process {}", id,
                        System.currentTimeMillis() - start, path);
            }
        }
        LOGGER.debug("processor ({}) stopped after {} files", id, processed);
        return processed;
    }
}
