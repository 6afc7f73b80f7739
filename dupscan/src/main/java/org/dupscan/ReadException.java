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

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file could not be opened or fully read while computing its digest.
 */
public class ReadException extends ScanException {

    private final Path path;

    public ReadException(Path path, IOException e) {
        super("can't read " + path + ": " + TraversalException.describe(e), e);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
