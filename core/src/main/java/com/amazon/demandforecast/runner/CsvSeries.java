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

import static com.amazon.demandforecast.CommonUtils.checkArgument;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.Getter;

import com.amazon.demandforecast.inputtypes.TimeSeries;

/**
 * A delimited table with a header row whose first column is a timestamp, whose
 * second column is the target and whose remaining columns are covariates.
 * Empty cells and the usual missing markers read as NaN.
 */
@Getter
public class CsvSeries {

    private static final List<String> MISSING = Arrays.asList("", "na", "nan", "null");

    private final String[] header;

    private final List<String[]> rows;

    private final TimeSeries series;

    CsvSeries(String[] header, List<String[]> rows, TimeSeries series) {
        this.header = header;
        this.rows = rows;
        this.series = series;
    }

    /**
     * @param in         the table, header row first
     * @param delimiter  the field delimiter, taken literally
     * @param targetName the name given to the target, whatever its header
     * @return the parsed table
     * @throws IOException              if the table cannot be read
     * @throws IllegalArgumentException if a line is malformed
     */
    public static CsvSeries read(BufferedReader in, String delimiter, String targetName) throws IOException {
        Pattern separator = Pattern.compile(Pattern.quote(delimiter));
        String line = in.readLine();
        checkArgument(line != null, "the input is empty, a header row is required");
        String[] header = separator.split(line.trim(), -1);
        checkArgument(header.length >= 2, "expected at least a timestamp and a target column");

        List<String[]> rows = new ArrayList<>();
        int lineNumber = 1;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = separator.split(line.trim(), -1);
            if (values.length != header.length) {
                throw new IllegalArgumentException(
                        String.format("Wrong number of values on line %d. Expected %d but found %d.", lineNumber,
                                header.length, values.length));
            }
            rows.add(values);
        }

        int size = rows.size();
        LocalDateTime[] timestamps = new LocalDateTime[size];
        double[] target = new double[size];
        Map<String, double[]> covariates = new LinkedHashMap<>();
        for (int j = 2; j < header.length; j++) {
            covariates.put(header[j].trim(), new double[size]);
        }
        for (int i = 0; i < size; i++) {
            String[] values = rows.get(i);
            timestamps[i] = parseTimestamp(values[0], i + 2);
            target[i] = parseValue(values[1]);
            for (int j = 2; j < header.length; j++) {
                covariates.get(header[j].trim())[i] = parseValue(values[j]);
            }
        }
        return new CsvSeries(header, rows, new TimeSeries(targetName, null, timestamps, target, covariates));
    }

    /**
     * accepts ISO timestamps with either a 'T' or a space between date and time
     */
    static LocalDateTime parseTimestamp(String value, int lineNumber) {
        try {
            return LocalDateTime.parse(value.trim().replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Incorrect timestamp on line " + lineNumber + ": " + value, e);
        }
    }

    static double parseValue(String value) {
        String trimmed = value.trim();
        if (MISSING.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }
}
