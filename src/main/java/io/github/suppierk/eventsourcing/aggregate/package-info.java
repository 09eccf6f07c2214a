/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Defines how aggregates keep their consistency and how they are rebuilt from events.
 *
 * <p>Here is an example to help explain how different objects are related to each other - let's
 * assume that we are building a wish list:
 *
 * <ul>
 *   <li>A user is an {@link io.github.suppierk.eventsourcing.aggregate.AggregateRoot} - it is the
 *       only entry point to change anything the user owns.
 *   <li>The user decides whether a change is allowed and records the outcome as a {@link
 *       io.github.suppierk.eventsourcing.event.DomainEvent}, like {@code Wish Made}. Only applying
 *       the event changes the state, so replaying the same events later never repeats the
 *       decision.
 *   <li>Wishes can be modelled in two ways:
 *       <ul>
 *         <li>As values inside the user, addressed by their index. Rules spanning all wishes, like
 *             {@code no more than 3 wishes}, are then enforced by the user alone.
 *         <li>As aggregates of their own which refer to the user by its identifier. The user
 *             stays small, but rules spanning all wishes can no longer be enforced atomically.
 *       </ul>
 *   <li>{@link io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository} loads the user by
 *       replaying its events, optionally starting from a {@link
 *       io.github.suppierk.eventsourcing.snapshot.Snapshot}, and saves new events only if nobody
 *       else saved the same user in the meantime.
 * </ul>
 */
package io.github.suppierk.eventsourcing.aggregate;
