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

import io.wipsim.core.BurndownPolicy;
import io.wipsim.core.GaussianArrivalGenerator;
import io.wipsim.core.RandomGenerators;
import io.wipsim.core.SimulationConfig;
import io.wipsim.core.SimulationSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;

/// Compare WIP and prioritization policies on ticket lead time
///
/// Tickets arrive every day with random effort, and a fixed daily capacity is spent on the open
/// tickets by each policy in turn. All policies see the same arrivals, so their lead time
/// summaries are directly comparable.
///
/// # Usage
/// ```
/// wipsim
/// wipsim 100
/// wipsim 250 --seed 42 --capacity 6 --policy SHORTEST_FIRST --policy OLDEST_FIRST
/// ```
@CommandLine.Command(name = "wipsim",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n%",
    optionListHeading = "%nOptions:%n",
    header = "Simulate the effect of WIP limits and prioritization on ticket lead time",
    description = "Runs a day-by-day simulation of randomly arriving tickets with random effort.\n" +
        "A fixed daily capacity is spent on open tickets by each policy over the same\n" +
        "arrival sequence, and the lead time of the tickets is summarized per policy.",
    mixinStandardHelpOptions = true,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "2:invalid arguments or configuration"})
public class CMD_wipsim implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_wipsim.class);

    /// Exit code for configuration values that are rejected before the run
    public static final int EXIT_INVALID_CONFIG = 2;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "DAYS",
        description = "Number of days to simulate (default: ${DEFAULT-VALUE})")
    private int days = SimulationConfig.DEFAULT_DAYS;

    @CommandLine.Option(names = {"--mean-arrivals"}, description = "Mean tickets arriving per day (default: ${DEFAULT-VALUE})")
    private double meanArrivals = 1.0;

    @CommandLine.Option(names = {"--stddev-arrivals"}, description = "Standard deviation of tickets per day (default: ${DEFAULT-VALUE})")
    private double stddevArrivals = 1.0;

    @CommandLine.Option(names = {"--mean-effort"}, description = "Mean effort of a ticket in hours (default: ${DEFAULT-VALUE})")
    private double meanEffort = 6.0;

    @CommandLine.Option(names = {"--stddev-effort"}, description = "Standard deviation of ticket effort in hours (default: ${DEFAULT-VALUE})")
    private double stddevEffort = 4.0;

    @CommandLine.Option(names = {"--min-effort"}, description = "Smallest effort of a ticket in hours (default: ${DEFAULT-VALUE})")
    private int minEffort = 1;

    @CommandLine.Option(names = {"-c", "--capacity"}, description = "Hours of work available per day (default: ${DEFAULT-VALUE})")
    private int capacity = 8;

    @CommandLine.Option(names = {"--wip-cap"}, description = "Hours per ticket per day for the equal working policy (default: ${DEFAULT-VALUE})")
    private int wipCap = 2;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Seed for the arrival generator (default: random)")
    private Long seed;

    @CommandLine.Option(names = {"--rng"}, description = "PRNG algorithm: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

    @CommandLine.Option(names = {"--detail-limit"},
        description = "Print per-day arrivals and ticket tables up to this many days or tickets (default: ${DEFAULT-VALUE})")
    private int detailLimit = SimulationConfig.DEFAULT_DETAIL_LIMIT;

    @CommandLine.Option(names = {"-p", "--policy"},
        description = "Policy to run, repeatable: ${COMPLETION-CANDIDATES} (default: all)")
    private List<BurndownPolicy> policies;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return EXIT_INVALID_CONFIG;
        }
        logger.info("Running with {}", config);

        SimulationSet simulationSet = new SimulationSet(config)
            .run(GaussianArrivalGenerator.from(config, algorithm));

        PrintWriter out = spec.commandLine().getOut();
        new SimulationReport(simulationSet).write(out);
        return 0;
    }

    SimulationConfig buildConfig() {
        SimulationConfig.Builder builder = SimulationConfig.builder()
            .days(days)
            .meanArrivalsPerDay(meanArrivals)
            .stddevArrivalsPerDay(stddevArrivals)
            .meanEffort(meanEffort)
            .stddevEffort(stddevEffort)
            .minEffort(minEffort)
            .dailyCapacityHours(capacity)
            .wipCapHoursPerTicket(wipCap)
            .detailLimit(detailLimit);
        if (seed != null) {
            builder.seed(seed);
        }
        if (policies != null && !policies.isEmpty()) {
            builder.policies(EnumSet.copyOf(policies));
        }
        return builder.build();
    }

    /// Run the wipsim command
    ///
    /// @param args command line arguments
    public static void main(String[] args) {
        logger.info("Creating wipsim command");
        CMD_wipsim cmd = new CMD_wipsim();
        logger.info("Executing command line");
        int exitCode = new CommandLine(cmd)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .execute(args);
        logger.info("Exiting main with code: {}", exitCode);
        System.exit(exitCode);
    }
}
