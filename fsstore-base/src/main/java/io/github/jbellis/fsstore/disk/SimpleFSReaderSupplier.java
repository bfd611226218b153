/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.fsstore.disk;

import java.io.IOException;

/**
 * Supplies per-thread readers over one file by cloning a single {@link SimpleFSIndexInput}.
 * All readers share one {@link InputFile}; the supplier owns the original input and closes it.
 */
public class SimpleFSReaderSupplier implements ReaderSupplier {
    private final SimpleFSIndexInput input;

    /**
     * @param input the input to clone; ownership passes to this supplier
     */
    public SimpleFSReaderSupplier(SimpleFSIndexInput input) {
        this.input = input;
    }

    @Override
    public SimpleFSIndexInput get() throws IOException {
        SimpleFSIndexInput reader = input.clone();
        reader.seek(0);
        return reader;
    }

    @Override
    public void close() {
        input.close();
    }
}
