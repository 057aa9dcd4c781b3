/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.demandforecast.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.StringJoiner;

/**
 * A command-line application that reads a complete series from an input
 * stream, processes it and writes a table to an output stream.
 */
public abstract class SeriesRunner {

    protected final ArgumentParser argumentParser;

    /**
     * @param runnerClass       The name of the runner class. This will be
     *                          displayed in the help text.
     * @param runnerDescription A description of the runner class. This will be
     *                          displayed in the help text.
     */
    protected SeriesRunner(String runnerClass, String runnerDescription) {
        this(new ArgumentParser(runnerClass, runnerDescription));
    }

    protected SeriesRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read the series, process it and write the result.
     *
     * @param in  An input stream with a header row followed by one row per step.
     * @param out An output stream where the result rows will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        CsvSeries table = CsvSeries.read(in, argumentParser.getDelimiter(), argumentParser.getTargetName());
        process(table, out);
        out.flush();
    }

    protected abstract void process(CsvSeries table, PrintWriter out);

    protected void writeRow(List<String> values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        values.forEach(joiner::add);
        out.println(joiner.toString());
    }
}
