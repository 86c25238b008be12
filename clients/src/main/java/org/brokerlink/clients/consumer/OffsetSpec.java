/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.brokerlink.clients.consumer;

/**
 * Where a consumer starts reading when it has no committed position. The two negative sentinels select the log
 * boundaries; any value {@code >= 0} is an explicit offset.
 */
public final class OffsetSpec {

    /** Start from the oldest retained message. */
    public static final long EARLIEST = -2L;

    /** Start after the newest message, receiving only what is published from now on. */
    public static final long LATEST = -1L;

    private OffsetSpec() {
    }

    public static boolean isEarliest(long offset) {
        return offset == EARLIEST;
    }

    public static boolean isLatest(long offset) {
        return offset == LATEST;
    }

    public static boolean isExplicit(long offset) {
        return offset >= 0;
    }

    /**
     * @return a readable form of {@code offset}: {@code earliest}, {@code latest}, the offset itself, or
     *         {@code unknown(n)} for a negative value that is not a sentinel
     */
    public static String describe(long offset) {
        if (offset == EARLIEST)
            return "earliest";
        if (offset == LATEST)
            return "latest";
        if (offset >= 0)
            return Long.toString(offset);
        return "unknown(" + offset + ")";
    }
}
