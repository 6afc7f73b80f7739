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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;

import org.apache.commons.codec.binary.Hex;
import org.dupscan.ScanException;

/**
 * Outcome of digesting one file.  Either a digest and the number of
 * bytes read, or the error that stopped it.  Immutable.
 */
public class FileRecord {

    /**
     * Digest (unsigned bytes) first, then path as unsigned UTF-8 bytes.
     * Records with equal digests end up next to each other.
     */
    public static final Comparator<FileRecord> DIGEST_THEN_PATH = (a, b) -> {
        int c = Arrays.compareUnsigned(a.digest, b.digest);
        if (c != 0) {
            return c;
        }
        return compareUtf8(a.path.toString(), b.path.toString());
    };

    private static final byte[] EMPTY = new byte[0];
    private static final Path NO_PATH = Paths.get("");

    private final Path path;
    private final byte[] digest;
    private final long size;
    private final ScanException error;

    private FileRecord(Path path, byte[] digest, long size, ScanException error) {
        this.path = path;
        this.digest = digest;
        this.size = size;
        this.error = error;
    }

    public static FileRecord success(Path path, byte[] digest, long size) {
        if (digest.length == 0) {
            throw new IllegalArgumentException("empty digest for " + path);
        }
        if (size < 0) {
            throw new IllegalArgumentException("negative size for " + path);
        }
        return new FileRecord(path, digest.clone(), size, null);
    }

    /**
     * @param path may be null when the failure isn't tied to a file
     */
    public static FileRecord failure(Path path, ScanException error) {
        return new FileRecord(path == null ? NO_PATH : path, EMPTY, 0, error);
    }

    public Path getPath() {
        return path;
    }

    public byte[] getDigest() {
        return digest.clone();
    }

    public String getHexDigest() {
        return Hex.encodeHexString(digest);
    }

    public boolean hasDigest() {
        return digest.length > 0;
    }

    public boolean hasSameDigest(FileRecord other) {
        return Arrays.equals(digest, other.digest);
    }

    public long getSize() {
        return size;
    }

    public boolean isError() {
        return error != null;
    }

    public ScanException getError() {
        return error;
    }

    static int compareUtf8(String a, String b) {
        return Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        if (error != null) {
            return "FileRecord{path=" + path + ", error=" + error.getMessage() + "}";
        }
        return "FileRecord{path=" + path + ", digest=" + getHexDigest() + ", size=" + size + "}";
    }
}
