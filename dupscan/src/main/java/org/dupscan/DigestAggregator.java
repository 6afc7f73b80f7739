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
package org.dupscan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

import org.dupscan.batchlite.AbstractResultConsumer;
import org.dupscan.digest.FileRecord;
import org.dupscan.report.ProgressEvent;
import org.dupscan.report.ReportSink;

/**
 * Buffers every record, reports throughput as it goes and gives up on the
 * first failed record.
 * <p>
 * The running average is an incremental mean of the per-tick rates, updated
 * once per tick, not bytes over total elapsed time.
 */
public class DigestAggregator extends AbstractResultConsumer<FileRecord> {

    private final ReportSink sink;
    private final long progressIntervalMillis;
    private final LongSupplier clock;
    private final List<FileRecord> results = new ArrayList<>();

    private long tickStart;
    private long windowBytes = 0;
    private int windowFiles = 0;
    private int ticks = 0;
    private double averageMegabytesPerSecond = 0.0;

    public DigestAggregator(ReportSink sink, long progressIntervalMillis) {
        this(sink, progressIntervalMillis, System::currentTimeMillis);
    }

    DigestAggregator(ReportSink sink, long progressIntervalMillis, LongSupplier clock) {
        this.sink = sink;
        this.progressIntervalMillis = progressIntervalMillis;
        this.clock = clock;
        this.tickStart = clock.getAsLong();
    }

    @Override
    protected void consume(FileRecord record) throws ScanException {
        windowBytes += record.getSize();
        windowFiles++;
        if (record.isError()) {
            throw record.getError();
        }
        long now = clock.getAsLong();
        long elapsed = now - tickStart;
        if (elapsed > progressIntervalMillis) {
            ticks++;
            double seconds = elapsed / 1000.0;
            double megabytesPerSecond = windowBytes / seconds / 1024 / 1024;
            averageMegabytesPerSecond += (megabytesPerSecond - averageMegabytesPerSecond) / ticks;
            sink.progress(new ProgressEvent(megabytesPerSecond, windowFiles,
                    averageMegabytesPerSecond));
            tickStart = now;
            windowBytes = 0;
            windowFiles = 0;
        }
        results.add(record);
    }

    /**
     * Only complete once the result stream has been drained.
     */
    public List<FileRecord> getResults() {
        return Collections.unmodifiableList(results);
    }

    public int getTicks() {
        return ticks;
    }
}
