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

import java.util.List;

/// Supplies the tickets arriving on each simulated day.
///
/// A {@link SimulationSet} asks once per day, in day order, and replays the answer to every
/// policy, so implementations never see a day twice within a run.
@FunctionalInterface
public interface ArrivalSource {

    /// @param day the simulated day, starting at 0
    /// @return the effort in hours of each ticket arriving that day, possibly empty
    List<Integer> effortsFor(int day);
}
