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

import java.util.List;

import lombok.Getter;

import com.amazon.demandforecast.returntypes.ModelFailure;

/**
 * Raised when neither forecaster produced a forecast; there is no further
 * fallback and no forecast is returned.
 */
@Getter
public class EnsembleFailureException extends ForecastException {

    private static final long serialVersionUID = 1L;

    private final transient List<ModelFailure> failures;

    public EnsembleFailureException(List<ModelFailure> failures) {
        super(Stage.COMBINER, "both forecasters failed to predict: " + failures);
        this.failures = List.copyOf(failures);
    }
}
