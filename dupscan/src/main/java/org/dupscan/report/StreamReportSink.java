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

import java.io.PrintStream;
import java.util.Locale;

/**
 * Writes the file listing to the output stream; progress and the summary
 * go to the error stream.
 */
public class StreamReportSink implements ReportSink {

    private static final String PROGRESS_FORMAT = "MB/s: %.2f\tfiles: %d\tMB/s (total): %.2f\n";

    private final PrintStream out;
    private final PrintStream err;

    public StreamReportSink(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void progress(ProgressEvent event) {
        err.printf(Locale.ROOT, PROGRESS_FORMAT, event.getMegabytesPerSecond(),
                event.getFiles(), event.getAverageMegabytesPerSecond());
    }

    @Override
    public void file(String hexDigest, String relativePath) {
        out.print(hexDigest + "\t" + relativePath + "\n");
    }

    @Override
    public void summary(DuplicateSummary summary) {
        out.flush();
        err.print("Duplicates   : " + summary.getDuplicates() + "\n");
        err.print("Duplicate MB : " + summary.getDuplicateMegabytes() + "\n");
        err.print("Total MB     : " + summary.getTotalMegabytes() + "\n");
        err.flush();
    }
}
