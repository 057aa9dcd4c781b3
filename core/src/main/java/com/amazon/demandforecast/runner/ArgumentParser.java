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
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.demandforecast.anomalydetection.AnomalyDetector;
import com.amazon.demandforecast.config.SequenceModelType;
import com.amazon.demandforecast.config.TrendModelType;
import com.amazon.demandforecast.inputtypes.TimeSeries;
import com.amazon.demandforecast.preprocessor.Preprocessor;
import com.amazon.demandforecast.sequence.AbstractNetworkForecaster;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/demand-forecast-core-1.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument horizon;
    private final IntegerArgument sequenceLength;
    private final EnumArgument<SequenceModelType> sequenceModel;
    private final EnumArgument<TrendModelType> trendModel;
    private final IntegerArgument epochs;
    private final DoubleArgument anomalyThreshold;
    private final IntegerArgument anomalyWindow;
    private final DoubleArgument suddenChangeThreshold;
    private final StringArgument delimiter;
    private final StringArgument targetName;
    private final StringArgument modelDirectory;
    private final StringArgument modelName;
    private final IntegerArgument randomSeed;

    /**
     * Create a new ArgumentParser. The runner class and runner description will be
     * used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        horizon = new IntegerArgument("-n", "--horizon", "Number of future steps to forecast.", 24,
                n -> checkArgument(n > 0, "horizon should be greater than 0"));
        addArgument(horizon);

        sequenceLength = new IntegerArgument("-l", "--sequence-length",
                "Number of past steps in each input window of the sequence model.",
                Preprocessor.DEFAULT_SEQUENCE_LENGTH,
                n -> checkArgument(n > 0, "sequence length should be greater than 0"));
        addArgument(sequenceLength);

        sequenceModel = new EnumArgument<>("-m", "--sequence-model",
                "The sequence model, one of RECURRENT or FEED_FORWARD.", AbstractNetworkForecaster.DEFAULT_TYPE,
                SequenceModelType.class);
        addArgument(sequenceModel);

        trendModel = new EnumArgument<>("-t", "--trend-model", "The trend model, one of DECOMPOSITION or PATTERN.",
                TrendModelType.DECOMPOSITION, TrendModelType.class);
        addArgument(trendModel);

        epochs = new IntegerArgument("-e", "--epochs", "Maximum number of training epochs, or 0 for the default.", 0,
                n -> checkArgument(n >= 0, "epochs cannot be negative"));
        addArgument(epochs);

        anomalyThreshold = new DoubleArgument(null, "--anomaly-threshold", "Z-score above which a value is flagged.",
                AnomalyDetector.DEFAULT_THRESHOLD, x -> checkArgument(x > 0, "threshold should be greater than 0"));
        addArgument(anomalyThreshold);

        anomalyWindow = new IntegerArgument(null, "--anomaly-window",
                "Length of the centered rolling window of the z-score method.", AnomalyDetector.DEFAULT_WINDOW,
                n -> checkArgument(n > 1, "anomaly window should be greater than 1"));
        addArgument(anomalyWindow);

        suddenChangeThreshold = new DoubleArgument(null, "--sudden-change-threshold",
                "Relative change between consecutive values above which a change is flagged.",
                AnomalyDetector.DEFAULT_SUDDEN_CHANGE_THRESHOLD,
                x -> checkArgument(x > 0, "sudden change threshold should be greater than 0"));
        addArgument(suddenChangeThreshold);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.", ",");
        addArgument(delimiter);

        targetName = new StringArgument(null, "--target-name",
                "Name given to the target column, the second column of the input.", TimeSeries.DEFAULT_TARGET_NAME);
        addArgument(targetName);

        modelDirectory = new StringArgument(null, "--model-dir",
                "Directory of stored models, reused when present. Empty to always train.", "");
        addArgument(modelDirectory);

        modelName = new StringArgument(null, "--model-name", "Name of the stored models.", "ensemble");
        addArgument(modelName);

        randomSeed = new IntegerArgument(null, "--random-seed", "Random seed of the sequence model.",
                (int) AbstractNetworkForecaster.DEFAULT_RANDOM_SEED);
        addArgument(randomSeed);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Remove the argument with the given long flag from help messages. This allows
     * runners to suppress arguments they do not use. The argument will still exist
     * in this object with its default value.
     *
     * @param longFlag The long flag corresponding to the argument being removed
     */
    protected void removeArgument(String longFlag) {
        Argument<?> argument = longFlags.get(longFlag);
        if (argument != null) {
            longFlags.remove(longFlag);
            shortFlags.remove(argument.getShortFlag());
        }
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    public int getHorizon() {
        return horizon.getValue();
    }

    public int getSequenceLength() {
        return sequenceLength.getValue();
    }

    public SequenceModelType getSequenceModel() {
        return sequenceModel.getValue();
    }

    public TrendModelType getTrendModel() {
        return trendModel.getValue();
    }

    /**
     * @return the user-specified number of epochs, 0 for the default of the model
     */
    public int getEpochs() {
        return epochs.getValue();
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold.getValue();
    }

    public int getAnomalyWindow() {
        return anomalyWindow.getValue();
    }

    public double getSuddenChangeThreshold() {
        return suddenChangeThreshold.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public String getTargetName() {
        return targetName.getValue();
    }

    /**
     * @return the model directory, empty when models are not stored
     */
    public String getModelDirectory() {
        return modelDirectory.getValue();
    }

    public String getModelName() {
        return modelName.getValue();
    }

    public int getRandomSeed() {
        return randomSeed.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }

    /**
     * an argument naming a constant of an enum, case insensitive and with dashes
     * accepted in place of underscores
     */
    public static class EnumArgument<E extends Enum<E>> extends Argument<E> {
        public EnumArgument(String shortFlag, String longFlag, String description, E defaultValue, Class<E> type) {
            super(shortFlag, longFlag, description, defaultValue,
                    x -> Enum.valueOf(type, x.trim().replace('-', '_').toUpperCase(Locale.ROOT)));
        }
    }
}
