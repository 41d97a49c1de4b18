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

/// The tickets that arrived on one day, as efforts in hours.
///
/// @param day the day of arrival
/// @param efforts effort of each ticket, in arrival order
public record DayArrivals(int day, List<Integer> efforts) {

    public DayArrivals {
        efforts = List.copyOf(efforts);
    }

    public int count() {
        return efforts.size();
    }

    public long totalEffort() {
        long sum = 0;
        for (int effort : efforts) {
            sum += effort;
        }
        return sum;
    }
}
