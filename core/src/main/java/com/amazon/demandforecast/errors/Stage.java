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
package com.amazon.demandforecast.errors;

/**
 * The pipeline stage that produced a failure. Every fatal error names its stage
 * so that a caller can tell preprocessing problems apart from model problems.
 */
public enum Stage {

    PREPROCESSING,

    SEQUENCE_MODEL,

    TREND_MODEL,

    COMBINER,

    ANOMALY_DETECTION,

    PERSISTENCE;

}
