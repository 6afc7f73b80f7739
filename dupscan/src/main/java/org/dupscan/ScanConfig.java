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

public class ScanConfig {

    public static final long DEFAULT_PROGRESS_INTERVAL_MILLIS = 1000;

    private int numThreads = Runtime.getRuntime().availableProcessors();

    //progress is reported once more than this has elapsed since the last report
    private long progressIntervalMillis = DEFAULT_PROGRESS_INTERVAL_MILLIS;

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        if (numThreads < 1) {
            throw new IllegalArgumentException("numThreads must be > 0, not " + numThreads);
        }
        this.numThreads = numThreads;
    }

    public long getProgressIntervalMillis() {
        return progressIntervalMillis;
    }

    public void setProgressIntervalMillis(long progressIntervalMillis) {
        if (progressIntervalMillis < 0) {
            throw new IllegalArgumentException("progress interval can't be negative");
        }
        this.progressIntervalMillis = progressIntervalMillis;
    }
}
