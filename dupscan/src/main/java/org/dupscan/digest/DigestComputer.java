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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.input.CountingInputStream;
import org.dupscan.ReadException;

/**
 * Streams a file through SHA-1.  Stateless and safe to share between threads.
 */
public class DigestComputer {

    /**
     * @return the file's digest and the number of bytes read
     * @throws ReadException if the file can't be opened or a read fails;
     * nothing is known about the file's content or size then
     */
    public FileRecord compute(Path file) throws ReadException {
        try (CountingInputStream is = new CountingInputStream(Files.newInputStream(file))) {
            byte[] digest = DigestUtils.sha1(is);
            return FileRecord.success(file, digest, is.getByteCount());
        } catch (IOException e) {
            throw new ReadException(file, e);
        }
    }
}
