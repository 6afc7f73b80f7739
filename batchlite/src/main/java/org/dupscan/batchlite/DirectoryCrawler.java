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
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first crawl of a directory that adds every regular file to the job
 * queue in directory-listing order.  Hidden entries (name starts with '.'),
 * the root included, are skipped with everything below them; a hidden root
 * yields no jobs and no failure.  Symbolic links, devices and other
 * special files are ignored.
 * <p>
 * The first directory that can't be opened or listed ends the crawl.  That
 * failure is turned into a result via the failure handler and handed
 * straight to the consumer.  Whatever happens, the job queue is closed
 * with one poison path per worker.
 */
public class DirectoryCrawler<R> implements Callable<Integer> {

    private static Logger LOGGER = LoggerFactory.getLogger(DirectoryCrawler.class);

    private final Path root;
    private final BlockingQueue<Path> queue;
    private final int numWorkers;
    private final AbstractResultConsumer<R> consumer;
    private final BiFunction<Path, IOException, R> failureHandler;
    private final AtomicBoolean stopped;
    private int added = 0;

    public DirectoryCrawler(Path root, BlockingQueue<Path> queue, int numWorkers,
                            AbstractResultConsumer<R> consumer,
                            BiFunction<Path, IOException, R> failureHandler,
                            AtomicBoolean stopped) {
        this.root = root;
        this.queue = queue;
        this.numWorkers = numWorkers;
        this.consumer = consumer;
        this.failureHandler = failureHandler;
        this.stopped = stopped;
    }

    @Override
    public Integer call() throws InterruptedException {
        try {
            if (isHidden(root)) {
                LOGGER.debug("root {} is hidden, nothing to crawl", root);
                return added;
            }
            BasicFileAttributes attrs = Files.readAttributes(root, BasicFileAttributes.class);
            if (!attrs.isDirectory()) {
                throw new NotDirectoryException(root.toString());
            }
            crawl(root);
        } catch (CrawlException e) {
            LOGGER.debug("failed to crawl " + e.dir, e.getCause());
            consumer.put(failureHandler.apply(e.dir, e.getCause()));
        } catch (IOException e) {
            LOGGER.debug("failed to read root " + root, e);
            consumer.put(failureHandler.apply(root, e));
        } finally {
            for (int i = 0; i < numWorkers; i++) {
                queue.offer(AbstractFileProcessor.POISON);
            }
        }
        LOGGER.debug("added {} files to the queue", added);
        return added;
    }

    private void crawl(Path dir) throws CrawlException {
        //the listing is read in full and the directory closed before
        //recursing, so only one directory handle is open at a time
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                entries.add(p);
            }
        } catch (IOException e) {
            throw new CrawlException(dir, e);
        } catch (DirectoryIteratorException e) {
            throw new CrawlException(dir, e.getCause());
        }

        for (Path p : entries) {
            if (stopped.get() || Thread.currentThread().isInterrupted()) {
                return;
            }
            if (isHidden(p)) {
                continue;
            }
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(p, BasicFileAttributes.class,
                        LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                throw new CrawlException(p, e);
            }
            if (attrs.isDirectory()) {
                crawl(p);
            } else if (attrs.isRegularFile()) {
                queue.offer(p);
                added++;
            }
        }
    }

    /**
     * @return true if the last name element starts with '.' and is neither
     * "." nor ".."
     */
    public static boolean isHidden(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String s = name.toString();
        return s.length() > 1 && s.charAt(0) == '.' && !"..".equals(s);
    }

    public int getAdded() {
        return added;
    }

    private static class CrawlException extends Exception {
        private final Path dir;

        private CrawlException(Path dir, IOException cause) {
            super(cause);
            this.dir = dir;
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
