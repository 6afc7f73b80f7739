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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DirectoryCrawlerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private LinkedBlockingQueue<Path> queue;
    private CollectingConsumer consumer;

    @Before
    public void setUp() throws Exception {
        root = tmp.newFolder("root").toPath();
        queue = new LinkedBlockingQueue<>();
        consumer = new CollectingConsumer();
    }

    @Test
    public void testSkipsHiddenEntries() throws Exception {
        write("a.txt", "hello");
        write("b/c.txt", "hello");
        write("b/.g", "hidden file");
        write(".hidden/e.txt", "hello");
        write(".f", "hidden file");
        write("..weird/f.txt", "still hidden");

        int added = crawler(3, new AtomicBoolean(false)).call();

        assertEquals(2, added);
        Set<String> expected = new HashSet<>();
        expected.add("a.txt");
        expected.add("b" + File.separator + "c.txt");
        assertEquals(expected, relativeJobs());
    }

    @Test
    public void testOnePoisonPerWorker() throws Exception {
        write("a.txt", "a");
        crawler(5, new AtomicBoolean(false)).call();
        int poison = 0;
        for (Path p : queue) {
            if (p == AbstractFileProcessor.POISON) {
                poison++;
            }
        }
        assertEquals(5, poison);
        assertEquals(6, queue.size());
    }

    @Test
    public void testEmptyDirectory() throws Exception {
        Files.createDirectories(root.resolve("x/y/z"));
        assertEquals(0, (int) crawler(1, new AtomicBoolean(false)).call());
        assertTrue(relativeJobs().isEmpty());
    }

    @Test
    public void testSymlinksAreIgnored() throws Exception {
        Path target = write("real.txt", "content");
        try {
            Files.createSymbolicLink(root.resolve("link.txt"), target);
            Files.createSymbolicLink(root.resolve("linkdir"), root.resolve("sub"));
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue("symlinks not supported here", false);
        }
        write("sub/s.txt", "sub");
        Set<String> jobs = crawlAndCollect();
        assertTrue(jobs.contains("real.txt"));
        assertTrue(jobs.contains("sub" + File.separator + "s.txt"));
        assertEquals(2, jobs.size());
    }

    @Test
    public void testMissingRoot() throws Exception {
        DirectoryCrawler<String> crawler = new DirectoryCrawler<>(root.resolve("nope"), queue, 2,
                consumer, (p, e) -> "FAILED:" + p, new AtomicBoolean(false));
        assertEquals(0, (int) crawler.call());
        assertEquals(2, queue.size());
        assertFailureReported();
    }

    @Test
    public void testHiddenRootIsNotCrawled() throws Exception {
        Path hiddenRoot = tmp.newFolder(".config").toPath();
        FileUtils.writeStringToFile(hiddenRoot.resolve("a.txt").toFile(), "hello",
                StandardCharsets.UTF_8);
        DirectoryCrawler<String> crawler = new DirectoryCrawler<>(hiddenRoot, queue, 2,
                consumer, (p, e) -> "FAILED:" + p, new AtomicBoolean(false));
        assertEquals(0, (int) crawler.call());
        assertEquals(2, queue.size());
        assertTrue(relativeJobs().isEmpty());

        consumer.shutdown();
        assertEquals(0, (int) consumer.call());
        assertEquals(0, consumer.getRecordsConsumed());
    }

    @Test
    public void testMissingHiddenRootIsNotAnError() throws Exception {
        DirectoryCrawler<String> crawler = new DirectoryCrawler<>(root.resolve(".gone"), queue, 1,
                consumer, (p, e) -> "FAILED:" + p, new AtomicBoolean(false));
        crawler.call();
        consumer.shutdown();
        assertEquals(0, (int) consumer.call());
    }

    @Test
    public void testRootIsAFile() throws Exception {
        Path file = write("a.txt", "a");
        DirectoryCrawler<String> crawler = new DirectoryCrawler<>(file, queue, 1,
                consumer, (p, e) -> "FAILED:" + p, new AtomicBoolean(false));
        crawler.call();
        assertFailureReported();
    }

    @Test
    public void testStoppedBeforeStart() throws Exception {
        write("a.txt", "a");
        write("b.txt", "b");
        assertEquals(0, (int) crawler(2, new AtomicBoolean(true)).call());
        assertEquals(2, queue.size());
    }

    @Test
    public void testIsHidden() {
        assertTrue(DirectoryCrawler.isHidden(Paths.get(".git")));
        assertTrue(DirectoryCrawler.isHidden(Paths.get("a", ".DS_Store")));
        assertFalse(DirectoryCrawler.isHidden(Paths.get(".")));
        assertFalse(DirectoryCrawler.isHidden(Paths.get("..")));
        assertFalse(DirectoryCrawler.isHidden(Paths.get("a.b")));
        assertFalse(DirectoryCrawler.isHidden(Paths.get(".hidden", "visible")));
    }

    private void assertFailureReported() throws Exception {
        consumer.shutdown();
        try {
            consumer.call();
        } catch (IOException e) {
            assertTrue(e.getMessage().startsWith("FAILED:"));
            return;
        }
        throw new AssertionError("expected the failure to reach the consumer");
    }

    private Set<String> crawlAndCollect() throws Exception {
        crawler(1, new AtomicBoolean(false)).call();
        return relativeJobs();
    }

    private DirectoryCrawler<String> crawler(int numWorkers, AtomicBoolean stopped) {
        return new DirectoryCrawler<>(root, queue, numWorkers, consumer,
                (p, e) -> "FAILED:" + p, stopped);
    }

    private Set<String> relativeJobs() {
        List<Path> jobs = new ArrayList<>(queue);
        Set<String> relative = new HashSet<>();
        for (Path p : jobs) {
            if (p != AbstractFileProcessor.POISON) {
                relative.add(root.relativize(p).toString());
            }
        }
        return relative;
    }

    private Path write(String relPath, String content) throws IOException {
        Path p = root.resolve(relPath);
        FileUtils.writeStringToFile(p.toFile(), content, StandardCharsets.UTF_8);
        return p;
    }
}
