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

package com.amazon.demandforecast.preprocessor;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A fixed length run of consecutive scaled rows, each row being the scaled
 * target followed by the scaled features, together with the scaled target of
 * the row that follows.
 */
@Getter
@AllArgsConstructor
public class FeatureWindow {

    private final double[][] rows;

    private final double label;

    private final LocalDateTime labelTimestamp;

    public int getLength() {
        return rows.length;
    }

    public int getWidth() {
        return (rows.length == 0) ? 0 : rows[0].length;
    }
}
