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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// A scripted arrival sequence that returns the same efforts every time it is asked.
///
/// Days without an entry have no arrivals.
///
/// ```java
/// ArrivalSource arrivals = FixedArrivals.builder()
///     .on(0, 5, 10)
///     .on(1, 3)
///     .build();
/// ```
public class FixedArrivals implements ArrivalSource {

    private final Map<Integer, List<Integer>> efforts;

    private FixedArrivals(Map<Integer, List<Integer>> efforts) {
        this.efforts = efforts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Replay arrivals recorded by an earlier run.
    public static FixedArrivals of(List<DayArrivals> recorded) {
        Builder builder = builder();
        for (DayArrivals arrivals : recorded) {
            for (int effort : arrivals.efforts()) {
                builder.on(arrivals.day(), effort);
            }
        }
        return builder.build();
    }

    @Override
    public List<Integer> effortsFor(int day) {
        return efforts.getOrDefault(day, Collections.emptyList());
    }

    public static class Builder {
        private final Map<Integer, List<Integer>> efforts = new TreeMap<>();

        private Builder() {
        }

        /// Add tickets arriving on a day, appended after any already added for it.
        public Builder on(int day, int... ticketEfforts) {
            if (day < 0) {
                throw new IllegalArgumentException("day must be non-negative, got " + day);
            }
            List<Integer> forDay = efforts.computeIfAbsent(day, d -> new ArrayList<>());
            for (int effort : ticketEfforts) {
                forDay.add(effort);
            }
            return this;
        }

        public FixedArrivals build() {
            Map<Integer, List<Integer>> frozen = new TreeMap<>();
            efforts.forEach((day, list) -> frozen.put(day, List.copyOf(list)));
            return new FixedArrivals(Collections.unmodifiableMap(frozen));
        }
    }
}
