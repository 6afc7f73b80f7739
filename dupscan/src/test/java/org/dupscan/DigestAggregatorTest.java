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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicLong;

import org.dupscan.digest.FileRecord;
import org.dupscan.report.ProgressEvent;
import org.dupscan.report.RecordingSink;
import org.junit.Before;
import org.junit.Test;

public class DigestAggregatorTest {

    private static final long MB = 1024 * 1024;

    private AtomicLong now;
    private RecordingSink sink;
    private DigestAggregator aggregator;

    @Before
    public void setUp() {
        now = new AtomicLong(0);
        sink = new RecordingSink();
        aggregator = new DigestAggregator(sink, 1000, now::get);
    }

    @Test
    public void testProgressTicks() throws Exception {
        now.set(500);
        aggregator.consume(record("a", MB));
        assertEquals(0, sink.getProgress().size());

        now.set(2000);
        aggregator.consume(record("b", MB));
        assertEquals(1, sink.getProgress().size());
        ProgressEvent first = sink.getProgress().get(0);
        assertEquals(1.0, first.getMegabytesPerSecond(), 0.000001);
        assertEquals(2, first.getFiles());
        assertEquals(1.0, first.getAverageMegabytesPerSecond(), 0.000001);

        now.set(4000);
        aggregator.consume(record("c", 3 * MB));
        ProgressEvent second = sink.getProgress().get(1);
        assertEquals(1.5, second.getMegabytesPerSecond(), 0.000001);
        assertEquals(1, second.getFiles());
        //incremental mean: 1.0 + (1.5 - 1.0) / 2
        assertEquals(1.25, second.getAverageMegabytesPerSecond(), 0.000001);

        assertEquals(2, aggregator.getTicks());
        assertEquals(3, aggregator.getResults().size());
    }

    @Test
    public void testNoTickAtExactlyOneInterval() throws Exception {
        now.set(1000);
        aggregator.consume(record("a", MB));
        assertEquals(0, sink.getProgress().size());
    }

    @Test
    public void testFirstErrorStopsConsumption() throws Exception {
        Path bad = Paths.get("bad");
        ReadException error = new ReadException(bad, new IOException("permission denied"));
        aggregator.put(record("a", 10));
        aggregator.put(FileRecord.failure(bad, error));
        aggregator.put(record("b", 10));
        aggregator.shutdown();
        try {
            aggregator.call();
            fail("should have thrown");
        } catch (ReadException e) {
            assertSame(error, e);
        }
        assertEquals(1, aggregator.getResults().size());
        assertEquals(Paths.get("a"), aggregator.getResults().get(0).getPath());
    }

    @Test
    public void testDrainsUntilShutdown() throws Exception {
        aggregator.put(record("a", 1));
        aggregator.put(record("b", 2));
        aggregator.shutdown();
        assertEquals(2, (int) aggregator.call());
        assertEquals(2, aggregator.getResults().size());
        assertTrue(sink.getProgress().isEmpty());
    }

    private static FileRecord record(String path, long size) {
        return FileRecord.success(Paths.get(path), new byte[]{(byte) path.hashCode()}, size);
    }
}
