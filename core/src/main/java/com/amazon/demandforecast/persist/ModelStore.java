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

package com.amazon.demandforecast.persist;

import static com.amazon.demandforecast.CommonUtils.checkArgument;
import static com.amazon.demandforecast.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.amazon.demandforecast.errors.ForecastException;
import com.amazon.demandforecast.errors.Stage;

/**
 * Stores state objects as JSON documents named {@code <name>.json} in a
 * directory. A missing or unreadable document is reported through
 * {@link LoadResult} rather than an exception.
 */
@Slf4j
public class ModelStore {

    public static final String EXTENSION = ".json";

    static final String TEMPORARY_SUFFIX = ".tmp";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    @Getter
    private final Path directory;

    private final ObjectMapper mapper;

    public ModelStore(Path directory) {
        this.directory = checkNotNull(directory, "directory cannot be null");
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path pathFor(String name) {
        checkNotNull(name, "name cannot be null");
        checkArgument(NAME.matcher(name).matches(), "incorrect artifact name " + name);
        return directory.resolve(name + EXTENSION);
    }

    public boolean exists(String name) {
        return Files.isRegularFile(pathFor(name));
    }

    /**
     * writes the state to a temporary file and moves it over any artifact of the
     * same name; a failed write leaves the previous artifact in place
     */
    public void save(String name, Object state) {
        checkNotNull(state, "state cannot be null");
        Path target = pathFor(name);
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, name, TEMPORARY_SUFFIX);
            mapper.writeValue(temporary.toFile(), state);
            move(temporary, target);
        } catch (IOException e) {
            discard(temporary, e);
            throw new ForecastException(Stage.PERSISTENCE, "cannot write " + target, e);
        }
        log.debug("saved {}", target);
    }

    static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move not supported for {}, replacing", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void discard(Path temporary, IOException cause) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    public <S> LoadResult<S> load(String name, Class<S> type) {
        Path source = pathFor(name);
        if (!Files.isRegularFile(source)) {
            return LoadResult.notFound(name);
        }
        try {
            S state = mapper.readValue(source.toFile(), type);
            if (state == null) {
                return LoadResult.corrupt(name, "empty document");
            }
            return LoadResult.loaded(state);
        } catch (JsonProcessingException e) {
            log.warn("artifact {} is corrupt: {}", source, e.getOriginalMessage());
            return LoadResult.corrupt(name, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("artifact {} cannot be read: {}", source, e.getMessage());
            return LoadResult.corrupt(name, e.getMessage());
        }
    }

    public boolean delete(String name) {
        try {
            return Files.deleteIfExists(pathFor(name));
        } catch (IOException e) {
            throw new ForecastException(Stage.PERSISTENCE, "cannot delete " + name, e);
        }
    }

    public String toJson(Object state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new ForecastException(Stage.PERSISTENCE, "cannot serialize state", e);
        }
    }
}
