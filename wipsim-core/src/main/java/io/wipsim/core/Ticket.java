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

import java.util.Arrays;

/// One unit of work and its remaining effort for every simulated day.
///
/// The remaining effort is kept per day: `remaining[d]` is what is left at the start of day `d`.
/// Slots before the start day are unused and stay zero. Each burn-down call on day `d` writes
/// slot `d + 1`, whether or not the ticket was worked on.
///
/// Tickets are mutable and owned by exactly one {@link Simulation}. The same arrival is handed
/// to each simulation via {@link #copy()}, so trajectories never alias across policies.
public class Ticket {

    private final int id;
    private final int startDay;
    private final int effort;
    private final int[] remaining;
    private int endDay;
    private int leadTime;

    /// Create a ticket arriving on the given day.
    ///
    /// @param id arrival index within the run, shared by all copies of this ticket
    /// @param startDay the day of arrival
    /// @param effort total hours of work required
    /// @param totalDays the simulation horizon, which sizes the per-day trajectory
    public Ticket(int id, int startDay, int effort, int totalDays) {
        if (id < 0) {
            throw new IllegalArgumentException("Ticket id must be non-negative: " + id);
        }
        if (startDay < 0 || startDay >= totalDays) {
            throw new IllegalArgumentException(
                String.format("Start day %d outside of horizon of %d days", startDay, totalDays));
        }
        if (effort < 1) {
            throw new IllegalArgumentException("Effort must be at least 1 hour: " + effort);
        }
        this.id = id;
        this.startDay = startDay;
        this.effort = effort;
        this.remaining = new int[totalDays];
        this.remaining[startDay] = effort;
    }

    private Ticket(Ticket other) {
        this.id = other.id;
        this.startDay = other.startDay;
        this.effort = other.effort;
        this.remaining = other.remaining.clone();
        this.endDay = other.endDay;
        this.leadTime = other.leadTime;
    }

    /// @return an independent deep copy, including its own remaining-effort trajectory
    public Ticket copy() {
        return new Ticket(this);
    }

    /// Burn down this ticket for one day.
    ///
    /// Spends `min(remaining, hoursOffered, hoursAvailable)` when there is work left and capacity
    /// to spend, then carries the (possibly reduced) remaining effort forward into `day + 1`.
    ///
    /// @param day the current day
    /// @param hoursAvailable capacity not yet spent today
    /// @param hoursOffered the most this call may spend on this ticket
    /// @return the capacity left after this ticket
    public int burn(int day, int hoursAvailable, int hoursOffered) {
        checkBurnable(day, hoursOffered);
        return burnFrom(remaining[day], day, hoursAvailable, hoursOffered);
    }

    /// Burn down this ticket a second time on the same day.
    ///
    /// Starts from what an earlier {@link #burn(int, int, int)} call carried forward into
    /// `day + 1`, so hours already spent today are not counted twice.
    ///
    /// @param day the current day, already burned once
    /// @param hoursAvailable capacity not yet spent today
    /// @param hoursOffered the most this call may spend on this ticket
    /// @return the capacity left after this ticket
    public int burnAgain(int day, int hoursAvailable, int hoursOffered) {
        checkBurnable(day, hoursOffered);
        return burnFrom(remaining[day + 1], day, hoursAvailable, hoursOffered);
    }

    private void checkBurnable(int day, int hoursOffered) {
        if (day < startDay) {
            throw new IllegalArgumentException(
                String.format("Ticket %d starts on day %d, cannot burn on day %d", id, startDay, day));
        }
        if (day + 1 >= remaining.length) {
            throw new IllegalArgumentException(
                String.format("No slot for day %d in a horizon of %d days", day + 1, remaining.length));
        }
        if (hoursOffered < 0) {
            throw new IllegalArgumentException("Offered hours must be non-negative: " + hoursOffered);
        }
    }

    private int burnFrom(int remain, int day, int hoursAvailable, int hoursOffered) {
        if (remain > 0 && hoursAvailable > 0) {
            int hours = Math.min(remain, Math.min(hoursOffered, hoursAvailable));
            if (hours > 0) {
                remain -= hours;
                hoursAvailable -= hours;
                endDay = day;
                leadTime = day + 1 - startDay;
            }
        }
        remaining[day + 1] = remain;
        return hoursAvailable;
    }

    public int getId() {
        return id;
    }

    public int getStartDay() {
        return startDay;
    }

    public int getEffort() {
        return effort;
    }

    /// @return the last day on which this ticket received work, 0 if it never did
    public int getEndDay() {
        return endDay;
    }

    /// @return days from arrival through the last worked day inclusive, 0 if never worked
    public int getLeadTime() {
        return leadTime;
    }

    public int remainingOn(int day) {
        return remaining[day];
    }

    /// @return days this ticket has been open on the given day, at least 1 from its start day on
    public int ageOn(int day) {
        return day + 1 - startDay;
    }

    /// @return a copy of the per-day remaining effort
    public int[] getRemaining() {
        return remaining.clone();
    }

    /// A ticket is completed once all of its effort has been burned. Since only worked days
    /// move the lead time, a completed ticket always has a positive lead time.
    public boolean isCompleted() {
        return leadTime > 0 && remaining[endDay + 1] == 0;
    }

    @Override
    public String toString() {
        return "Ticket{" +
            "id=" + id +
            ", startDay=" + startDay +
            ", leadTime=" + leadTime +
            ", endDay=" + endDay +
            ", effort=" + effort +
            ", remaining=" + Arrays.toString(remaining) +
            '}';
    }
}
