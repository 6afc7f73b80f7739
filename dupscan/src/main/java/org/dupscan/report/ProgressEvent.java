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

/**
 * Throughput over one tick.
 */
public class ProgressEvent {

    private final double megabytesPerSecond;
    private final int files;
    private final double averageMegabytesPerSecond;

    public ProgressEvent(double megabytesPerSecond, int files, double averageMegabytesPerSecond) {
        this.megabytesPerSecond = megabytesPerSecond;
        this.files = files;
        this.averageMegabytesPerSecond = averageMegabytesPerSecond;
    }

    public double getMegabytesPerSecond() {
        return megabytesPerSecond;
    }

    /**
     * @return files received since the previous tick
     */
    public int getFiles() {
        return files;
    }

    /**
     * @return running mean of the per-tick rates so far
     */
    public double getAverageMegabytesPerSecond() {
        return averageMegabytesPerSecond;
    }

    @Override
    public String toString() {
        return "ProgressEvent{" + megabytesPerSecond + " MB/s, files=" + files +
                ", average=" + averageMegabytesPerSecond + " MB/s}";
    }
}
