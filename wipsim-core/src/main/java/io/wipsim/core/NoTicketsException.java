package io.wipsim.core;

/*
 * Copyright (c) nosqlbench
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *   http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Thrown when lead time statistics are requested for a population without tickets.
/// Mean and deviation are undefined there, so no NaN values are produced.
public class NoTicketsException extends RuntimeException {

    private final String simulationName;

    public NoTicketsException(String simulationName) {
        super(String.format("Lead time is undefined for '%s': no tickets", simulationName));
        this.simulationName = simulationName;
    }

    public String getSimulationName() {
        return simulationName;
    }
}
