// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.exceptions.IngestionArgumentException;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import org.apache.commons.text.TextStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/**
 * Builds the {@link IngestionProperties} of one call in two phases: every option is first checked against the
 * active {@link IngestionMode}, then all options are applied in call order and the result is validated.
 * Nothing is returned unless every phase succeeds.
 */
public class IngestionPropertiesBuilder {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private IngestionPropertiesBuilder() {
    }

    public static IngestionProperties build(String databaseName, String tableName, IngestionMode mode, String operation, IngestionOption... options) {
        Ensure.argIsNotNull(mode, "mode");
        Ensure.argIsNotNull(options, "options");

        TextStringBuilder message = new TextStringBuilder();
        for (IngestionOption option : options) {
            if (option == null) {
                message.appendln("A null option was passed.");
            } else if (!option.getSupportedModes().contains(mode)) {
                message.appendln("Option '%s' is not supported for %s ingestion.", option.getName(), mode);
            }
        }
        if (!message.isEmpty()) {
            String messageStr = message.build();
            log.error("{}: {}", operation, messageStr);
            throw new IngestionArgumentException(operation, messageStr);
        }

        IngestionProperties properties = new IngestionProperties(databaseName, tableName);
        properties.setRetainBlobOnSuccess(mode.isQueued());
        for (IngestionOption option : options) {
            option.apply(properties);
        }

        properties.validate(operation);
        return properties;
    }
}
