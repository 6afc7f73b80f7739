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

public class DuplicateSummary {

    private static final double BYTES_PER_MB = 1024 * 1024;

    private final int files;
    private final int duplicates;
    private final long duplicateBytes;
    private final long totalBytes;

    public DuplicateSummary(int files, int duplicates, long duplicateBytes, long totalBytes) {
        this.files = files;
        this.duplicates = duplicates;
        this.duplicateBytes = duplicateBytes;
        this.totalBytes = totalBytes;
    }

    public int getFiles() {
        return files;
    }

    /**
     * @return files whose digest matched an earlier file's; the first file
     * of each group is not counted
     */
    public int getDuplicates() {
        return duplicates;
    }

    public long getDuplicateBytes() {
        return duplicateBytes;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public double getDuplicateMegabytes() {
        return duplicateBytes / BYTES_PER_MB;
    }

    public double getTotalMegabytes() {
        return totalBytes / BYTES_PER_MB;
    }

    @Override
    public String toString() {
        return "DuplicateSummary{files=" + files + ", duplicates=" + duplicates +
                ", duplicateBytes=" + duplicateBytes + ", totalBytes=" + totalBytes + "}";
    }
}
