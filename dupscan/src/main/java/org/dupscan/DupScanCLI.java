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

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.dupscan.report.StreamReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the SHA-1 of every file under a directory, sorted by digest,
 * and reports how much of it is duplicated.
 * <p>
 * Usage: {@code dupscan [-n numThreads] <rootDir>}
 */
public class DupScanCLI {

    private static Logger LOGGER = LoggerFactory.getLogger(DupScanCLI.class);

    private static final String USAGE = "dupscan [options] <rootDir>";

    private static Options getOptions() {
        Options options = new Options();
        options.addOption("n", "numThreads", true,
                "number of digesting threads (default: number of cpus)");
        options.addOption("h", "help", false, "print this message");
        return options;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return the process exit value
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineParser cliParser = new DefaultParser();
        ScanConfig config = new ScanConfig();
        Path root;
        try {
            CommandLine line = cliParser.parse(getOptions(), args);
            if (line.hasOption("h")) {
                usage(err);
                return 0;
            }
            if (line.hasOption("n")) {
                config.setNumThreads(Integer.parseInt(line.getOptionValue("n")));
            }
            List<String> rest = line.getArgList();
            if (rest.isEmpty() || rest.get(0).isEmpty()) {
                throw new ParseException("Arg 0 (rootDir) missing.");
            }
            root = Paths.get(rest.get(0));
        } catch (ParseException | IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            usage(err);
            return 1;
        }

        try {
            new DupScanner(config, new StreamReportSink(out, err)).scan(root);
        } catch (ScanException e) {
            LOGGER.debug("scan failed", e);
            err.println("ERROR: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private static void usage(PrintStream err) {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8));
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null,
                getOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
