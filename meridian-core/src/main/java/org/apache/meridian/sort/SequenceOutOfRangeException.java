/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.meridian.sort;

/** 跳过的元素数量超过了序列中剩余的元素。 */
public class SequenceOutOfRangeException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    private final long requested;
    private final long remaining;

    public SequenceOutOfRangeException(long requested, long remaining) {
        super(
                String.format(
                        "Cannot skip %s elements, only %s remaining.", requested, remaining));
        this.requested = requested;
        this.remaining = remaining;
    }

    public long getRequested() {
        return requested;
    }

    public long getRemaining() {
        return remaining;
    }
}
