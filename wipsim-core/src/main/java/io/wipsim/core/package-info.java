/// Day-by-day ticket burn-down engine.
///
/// A {@link io.wipsim.core.SimulationSet} draws each day's arrivals once from an
/// {@link io.wipsim.core.ArrivalSource} and hands a private copy of every new
/// {@link io.wipsim.core.Ticket} to one {@link io.wipsim.core.Simulation} per
/// {@link io.wipsim.core.BurndownPolicy}. Each simulation then spends the daily capacity on its
/// own population, and {@link io.wipsim.core.LeadTimeStatistics} summarizes the outcome.
///
/// ## Key Components
///
/// - {@link io.wipsim.core.Ticket}: remaining effort per day and the burn-down primitive
/// - {@link io.wipsim.core.BurndownPolicy}: the five capacity allocation policies
/// - {@link io.wipsim.core.SimulationConfig}: validated run parameters
/// - {@link io.wipsim.core.GaussianArrivalGenerator}: seeded random arrivals
/// - {@link io.wipsim.core.FixedArrivals}: scripted or replayed arrivals
///
/// ## Usage Example
///
/// ```java
/// SimulationConfig config = SimulationConfig.builder().days(100).seed(42L).build();
/// SimulationSet set = new SimulationSet(config).run(GaussianArrivalGenerator.from(config));
/// for (Simulation simulation : set.getSimulations()) {
///     simulation.leadTimeStatistics().ifPresent(System.out::println);
/// }
/// ```
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

