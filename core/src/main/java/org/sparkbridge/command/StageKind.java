/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sparkbridge.command;

/**
 * Tags of the pipeline stages a {@link Command} can hold.
 */
public enum StageKind {
  /** One output per input element. */
  MAP,
  /** Zero or more outputs per input element. */
  FLAT_MAP,
  /** Keeps the elements the predicate accepts. */
  FILTER,
  /** Transforms the whole partition iterator at once. */
  MAP_PARTITIONS,
  /** Like MAP_PARTITIONS, also receiving the partition index. */
  MAP_PARTITIONS_WITH_INDEX
}
