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
package org.dupscan.report;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.dupscan.PathException;
import org.dupscan.digest.FileRecord;

/**
 * Sorts the records by digest and path, lists them, and counts a record as
 * a duplicate when it has the same digest as the record listed just
 * before it.
 */
public class DuplicateReporter {

    private final ReportSink sink;

    public DuplicateReporter(ReportSink sink) {
        this.sink = sink;
    }

    public DuplicateSummary report(Path root, Collection<FileRecord> records) throws PathException {
        List<FileRecord> sorted = new ArrayList<>(records);
        sorted.sort(FileRecord.DIGEST_THEN_PATH);

        int duplicates = 0;
        long duplicateBytes = 0;
        long totalBytes = 0;
        FileRecord previous = null;
        for (FileRecord r : sorted) {
            sink.file(r.getHexDigest(), relativize(root, r.getPath()));
            totalBytes += r.getSize();
            if (previous != null && r.hasDigest() && r.hasSameDigest(previous)) {
                duplicates++;
                duplicateBytes += r.getSize();
            }
            previous = r;
        }
        DuplicateSummary summary = new DuplicateSummary(sorted.size(), duplicates,
                duplicateBytes, totalBytes);
        sink.summary(summary);
        return summary;
    }

    static String relativize(Path root, Path path) throws PathException {
        try {
            return root.relativize(path).toString();
        } catch (IllegalArgumentException e) {
            throw new PathException(path, root, e);
        }
    }
}
