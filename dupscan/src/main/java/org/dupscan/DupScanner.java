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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.dupscan.batchlite.AbstractDirectoryProcessor;
import org.dupscan.batchlite.AbstractFileProcessor;
import org.dupscan.batchlite.AbstractResultConsumer;
import org.dupscan.digest.DigestComputer;
import org.dupscan.digest.DigestProcessor;
import org.dupscan.digest.FileRecord;
import org.dupscan.report.DuplicateReporter;
import org.dupscan.report.DuplicateSummary;
import org.dupscan.report.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Digests every visible regular file under a root and reports the
 * duplicates.  Any failure, whether a directory that can't be listed or
 * a single unreadable file, ends the scan without a report.
 */
public class DupScanner extends AbstractDirectoryProcessor<FileRecord> {

    private static Logger LOGGER = LoggerFactory.getLogger(DupScanner.class);

    private final ScanConfig config;
    private final ReportSink sink;
    private final DigestComputer digestComputer;

    public DupScanner(ScanConfig config, ReportSink sink) {
        this(config, sink, new DigestComputer());
    }

    /**
     * @param digestComputer shared by every worker, so it must be thread-safe
     */
    public DupScanner(ScanConfig config, ReportSink sink, DigestComputer digestComputer) {
        this.config = config;
        this.sink = sink;
        this.digestComputer = digestComputer;
    }

    public DuplicateSummary scan(Path root) throws ScanException {
        DigestAggregator aggregator = new DigestAggregator(sink, config.getProgressIntervalMillis());
        try {
            execute(root, aggregator);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ScanException) {
                throw (ScanException) cause;
            }
            LOGGER.error("unexpected failure scanning " + root, cause);
            throw new ScanException("unexpected failure scanning " + root + ": " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException("interrupted while scanning " + root, e);
        }
        return new DuplicateReporter(sink).report(root, aggregator.getResults());
    }

    @Override
    public List<AbstractFileProcessor<FileRecord>> getProcessors(BlockingQueue<Path> queue,
                                                                 AbstractResultConsumer<FileRecord> consumer,
                                                                 AtomicBoolean stopped) {
        List<AbstractFileProcessor<FileRecord>> processors = new ArrayList<>();
        for (int i = 0; i < config.getNumThreads(); i++) {
            processors.add(new DigestProcessor(queue, consumer, stopped, digestComputer));
        }
        return processors;
    }

    @Override
    protected FileRecord traversalFailed(Path path, IOException e) {
        return FileRecord.failure(null, new TraversalException(path, e));
    }
}
