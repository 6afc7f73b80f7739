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

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer at the end of the pipeline.  Any number of producers
 * may call {@link #put(Object)}; implementations of {@link #consume(Object)}
 * only ever run on the consumer's own thread and don't have to worry
 * about thread safety.
 * <p>
 * The stream ends when {@link #shutdown()} is called.  If {@link #consume(Object)}
 * throws, consumption stops immediately and anything still queued is abandoned.
 */
public abstract class AbstractResultConsumer<R> implements Callable<Integer> {

    private static Logger LOGGER = LoggerFactory.getLogger(AbstractResultConsumer.class);

    //end of stream; compared by identity
    private final Entry<R> poison = new Entry<>(null);

    private final LinkedBlockingQueue<Entry<R>> results = new LinkedBlockingQueue<>();
    private int recordsConsumed = 0;

    protected abstract void consume(R result) throws Exception;

    /**
     * Called once after the last result has been consumed.
     */
    protected void finish() throws Exception {
    }

    public void put(R result) throws InterruptedException {
        results.put(new Entry<>(Objects.requireNonNull(result)));
    }

    /**
     * Closes the result stream.  Results put after this are never consumed.
     */
    public void shutdown() {
        //unbounded queue, so this can't fail
        results.offer(poison);
    }

    @Override
    public Integer call() throws Exception {
        while (true) {
            Entry<R> next = results.take();
            if (next == poison) {
                finish();
                LOGGER.debug("result stream closed after {} records", recordsConsumed);
                return recordsConsumed;
            }
            consume(next.result);
            if (++recordsConsumed % 1000 == 0) {
                LOGGER.debug("consumed {} records", recordsConsumed);
            }
        }
    }

    public int getRecordsConsumed() {
        return recordsConsumed;
    }

    private static class Entry<T> {
        private final T result;

        private Entry(T result) {
            this.result = result;
        }
    }
}
