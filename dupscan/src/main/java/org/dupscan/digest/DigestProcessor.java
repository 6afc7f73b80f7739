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
package org.dupscan.digest;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.dupscan.ReadException;
import org.dupscan.batchlite.AbstractFileProcessor;
import org.dupscan.batchlite.AbstractResultConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker that digests each queued file.  A file that can't be read becomes
 * a failed record; what to do about it is the consumer's call.
 */
public class DigestProcessor extends AbstractFileProcessor<FileRecord> {

    private static Logger LOGGER = LoggerFactory.getLogger(DigestProcessor.class);

    private final DigestComputer digestComputer;

    public DigestProcessor(BlockingQueue<Path> queue, AbstractResultConsumer<FileRecord> consumer,
                           AtomicBoolean stopped, DigestComputer digestComputer) {
        super(queue, consumer, stopped);
        this.digestComputer = digestComputer;
    }

    @Override
    protected FileRecord process(Path path) {
        try {
            return digestComputer.compute(path);
        } catch (ReadException e) {
            LOGGER.debug("problem digesting " + path, e);
            return FileRecord.failure(path, e);
        }
    }
}
