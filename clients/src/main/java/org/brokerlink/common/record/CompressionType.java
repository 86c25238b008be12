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
package org.brokerlink.common.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The compression type to use
 */
public enum CompressionType {
    NONE((byte) 0, "none"),
    GZIP((byte) 1, "gzip"),
    SNAPPY((byte) 2, "snappy"),
    LZ4((byte) 3, "lz4"),
    ZSTD((byte) 4, "zstd");

    private static final List<String> NAMES;

    static {
        List<String> names = new ArrayList<>();
        for (CompressionType type : values())
            names.add(type.name);
        NAMES = Collections.unmodifiableList(names);
    }

    // compression type is represented by two bits in the attributes field of the record batch header, so `byte` is
    // large enough
    public final byte id;
    public final String name;

    CompressionType(byte id, String name) {
        this.id = id;
        this.name = name;
    }

    public static CompressionType forId(int id) {
        switch (id) {
            case 0:
                return NONE;
            case 1:
                return GZIP;
            case 2:
                return SNAPPY;
            case 3:
                return LZ4;
            case 4:
                return ZSTD;
            default:
                throw new IllegalArgumentException("Unknown compression type id: " + id);
        }
    }

    /** Case insensitive lookup by codec name */
    public static CompressionType forName(String name) {
        String lower = name == null ? null : name.toLowerCase(Locale.ROOT);
        if (NONE.name.equals(lower))
            return NONE;
        else if (GZIP.name.equals(lower))
            return GZIP;
        else if (SNAPPY.name.equals(lower))
            return SNAPPY;
        else if (LZ4.name.equals(lower))
            return LZ4;
        else if (ZSTD.name.equals(lower))
            return ZSTD;
        else
            throw new IllegalArgumentException("Unknown compression name: " + name);
    }

    public static boolean isKnown(String name) {
        return name != null && NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    public static List<String> names() {
        return NAMES;
    }

    @Override
    public String toString() {
        return name;
    }

}
