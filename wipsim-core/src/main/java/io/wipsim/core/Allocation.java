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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Hours spent per ticket during one day's burn-down, split by pass.
///
/// The first pass is the policy's primary pass. Only the equal-working policy has a
/// second pass, which spends whatever capacity the capped first pass left over.
public class Allocation {

    private final int day;
    private final int capacity;
    private final Map<Integer, Integer> firstPass = new LinkedHashMap<>();
    private final Map<Integer, Integer> secondPass = new LinkedHashMap<>();

    public Allocation(int day, int capacity) {
        this.day = day;
        this.capacity = capacity;
    }

    void recordFirstPass(int ticketId, int hours) {
        if (hours > 0) {
            firstPass.merge(ticketId, hours, Integer::sum);
        }
    }

    void recordSecondPass(int ticketId, int hours) {
        if (hours > 0) {
            secondPass.merge(ticketId, hours, Integer::sum);
        }
    }

    public int getDay() {
        return day;
    }

    public int getCapacity() {
        return capacity;
    }

    public int firstPassHoursFor(int ticketId) {
        return firstPass.getOrDefault(ticketId, 0);
    }

    public int secondPassHoursFor(int ticketId) {
        return secondPass.getOrDefault(ticketId, 0);
    }

    public int hoursFor(int ticketId) {
        return firstPassHoursFor(ticketId) + secondPassHoursFor(ticketId);
    }

    /// @return total hours spent on all tickets this day
    public int total() {
        int sum = 0;
        for (int hours : firstPass.values()) {
            sum += hours;
        }
        for (int hours : secondPass.values()) {
            sum += hours;
        }
        return sum;
    }

    public int unused() {
        return capacity - total();
    }

    /// @return ticket id to hours for the first pass, in the order tickets were worked
    public Map<Integer, Integer> getFirstPass() {
        return Collections.unmodifiableMap(firstPass);
    }

    public Map<Integer, Integer> getSecondPass() {
        return Collections.unmodifiableMap(secondPass);
    }

    @Override
    public String toString() {
        return "Allocation{day=" + day + ", capacity=" + capacity +
            ", firstPass=" + firstPass + ", secondPass=" + secondPass + '}';
    }
}
