// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data validation the service applies to CSV input before ingesting it.
 */
public class ValidationPolicy {
    @JsonProperty("ValidationOptions")
    private final ValidationOptions validationOptions;
    @JsonProperty("ValidationImplications")
    private final ValidationImplications validationImplications;

    public ValidationPolicy(ValidationOptions validationOptions, ValidationImplications validationImplications) {
        this.validationOptions = validationOptions;
        this.validationImplications = validationImplications;
    }

    public ValidationOptions getValidationOptions() {
        return validationOptions;
    }

    public ValidationImplications getValidationImplications() {
        return validationImplications;
    }

    public enum ValidationOptions {
        DO_NOT_VALIDATE("DoNotValidate"),
        VALIDATE_CSV_INPUT_CONSTANT_COLUMNS("ValidateCsvInputConstantColumns"),
        VALIDATE_CSV_INPUT_COLUMN_LEVEL_ONLY("ValidateCsvInputColumnLevelOnly");

        private final String kustoValue;

        ValidationOptions(String kustoValue) {
            this.kustoValue = kustoValue;
        }

        @JsonValue
        public String getKustoValue() {
            return kustoValue;
        }
    }

    public enum ValidationImplications {
        FAIL("Fail"),
        BEST_EFFORT("BestEffort");

        private final String kustoValue;

        ValidationImplications(String kustoValue) {
            this.kustoValue = kustoValue;
        }

        @JsonValue
        public String getKustoValue() {
            return kustoValue;
        }
    }
}
