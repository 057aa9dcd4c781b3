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

import lombok.Getter;

/**
 * The outcome of reading a stored artifact. An absent or unreadable artifact
 * is an ordinary result that callers can act on, for example by training.
 *
 * @param <T> the type of the loaded value
 */
@Getter
public class LoadResult<T> {

    public enum Status {
        LOADED, NOT_FOUND, CORRUPT
    }

    private final Status status;

    private final T value;

    private final String message;

    private LoadResult(Status status, T value, String message) {
        this.status = status;
        this.value = value;
        this.message = message;
    }

    public static <T> LoadResult<T> loaded(T value) {
        return new LoadResult<>(Status.LOADED, checkNotNull(value, "value cannot be null"), "loaded");
    }

    public static <T> LoadResult<T> notFound(String name) {
        return new LoadResult<>(Status.NOT_FOUND, null, "no artifact named " + name);
    }

    public static <T> LoadResult<T> corrupt(String name, String reason) {
        return new LoadResult<>(Status.CORRUPT, null, "artifact " + name + " is unreadable: " + reason);
    }

    /**
     * carries an unsuccessful result over to another value type
     */
    public static <T> LoadResult<T> failed(LoadResult<?> other) {
        checkArgument(!other.isLoaded(), "result was loaded");
        return new LoadResult<>(other.status, null, other.message);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }

    @Override
    public String toString() {
        return status + ": " + message;
    }
}
