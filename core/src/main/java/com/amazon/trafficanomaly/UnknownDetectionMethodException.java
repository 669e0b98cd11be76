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

package com.amazon.trafficanomaly;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * Thrown when a pipeline configured with
 * {@link com.amazon.trafficanomaly.config.UnknownMethodPolicy#REJECT} is asked
 * to run detection methods it does not know.
 */
public class UnknownDetectionMethodException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final Set<String> unknownMethods;

    public UnknownDetectionMethodException(Collection<String> unknownMethods, Collection<String> knownMethods) {
        super(String.format("Unknown detection methods %s, expected any of %s",
                new LinkedHashSet<>(unknownMethods), knownMethods));
        this.unknownMethods = Collections.unmodifiableSet(new LinkedHashSet<>(unknownMethods));
    }

    public Set<String> getUnknownMethods() {
        return unknownMethods;
    }
}
