package io.wipsim.command;

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

import io.wipsim.core.DayArrivals;
import io.wipsim.core.LeadTimeStatistics;
import io.wipsim.core.Simulation;
import io.wipsim.core.SimulationSet;
import io.wipsim.core.Ticket;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Renders a finished {@link SimulationSet} as plain text.
///
/// Short runs get the full per-day arrival trace and a ticket table per policy; both are left
/// out once the day count or the population exceeds the configured detail limit.
public class SimulationReport {

    static final String LEAD_TIME_FORMAT = "Leadtime of tickets mean: %.2f stdev: %.2f mean+stdev: %.2f";
    static final String NO_TICKETS = "Leadtime of tickets: no tickets";

    private final SimulationSet simulationSet;
    private final int detailLimit;

    public SimulationReport(SimulationSet simulationSet) {
        this.simulationSet = simulationSet;
        this.detailLimit = simulationSet.getConfig().getDetailLimit();
    }

    public void write(PrintWriter out) {
        int days = simulationSet.getConfig().getDays();
        out.println("Simulating " + days + " days");
        if (days <= detailLimit) {
            out.println("day, count, effort");
            for (DayArrivals arrivals : simulationSet.getArrivals()) {
                out.println(arrivals.day() + ", " + arrivals.count() + ", " + arrivals.efforts());
            }
        }
        out.println();
        out.println(String.format(Locale.ROOT, "mean ticket count per day: %.2f", simulationSet.meanArrivalsPerDay()));
        out.println(String.format(Locale.ROOT, "mean ticket effort per day: %.2f", simulationSet.meanEffortPerDay()));
        out.println();
        for (Simulation simulation : simulationSet.getSimulations()) {
            writeSimulation(out, simulation);
            out.println();
        }
        out.flush();
    }

    private void writeSimulation(PrintWriter out, Simulation simulation) {
        out.println(simulation.getName());
        Optional<LeadTimeStatistics> stats = simulation.leadTimeStatistics();
        if (stats.isEmpty()) {
            out.println(NO_TICKETS);
            return;
        }
        out.println(formatStatistics(stats.get()));
        out.println("completed: " + stats.get().completed() + " open: " + stats.get().open());
        List<Ticket> tickets = simulation.getTickets();
        if (tickets.size() <= detailLimit) {
            out.println("# start leadtime end effort [remaining per day]");
            for (Ticket ticket : tickets) {
                out.println(ticket.getId() + " " + ticket.getStartDay() + " " + ticket.getLeadTime() + " "
                    + ticket.getEndDay() + " " + ticket.getEffort() + " " + Arrays.toString(ticket.getRemaining()));
            }
        }
    }

    static String formatStatistics(LeadTimeStatistics stats) {
        return String.format(Locale.ROOT, LEAD_TIME_FORMAT, stats.mean(), stats.stdev(), stats.meanPlusStdev());
    }
}
