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

package org.apache.meridian.data;

import org.apache.meridian.annotation.Public;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

import static org.apache.meridian.utils.Preconditions.checkArgument;

/**
 * DECIMAL(p, s) 类型的内部表示。
 *
 * <p>一个 Decimal 由精度、小数位数和数值组成,数值的小数位数总是等于 {@link #scale()}。精度不超过 {@link
 * #MAX_COMPACT_PRECISION} 时,未缩放的数值可以放进一个 long,序列化器据此选择紧凑格式。
 */
@Public
public final class Decimal implements Comparable<Decimal> {

    /** 未缩放值可以用 long 表示的最大精度。 */
    public static final int MAX_COMPACT_PRECISION = 18;

    /** 支持的最大精度。 */
    public static final int MAX_PRECISION = 38;

    private final int precision;

    private final int scale;

    private final BigDecimal decimalVal;

    private Decimal(int precision, int scale, BigDecimal decimalVal) {
        this.precision = precision;
        this.scale = scale;
        this.decimalVal = decimalVal;
    }

    /**
     * 按给定精度与小数位数创建 Decimal。
     *
     * <p>数值会按 HALF_UP 舍入到 {@code scale} 位小数;舍入后的有效位数超出 {@code precision} 时返回 null。
     */
    @Nullable
    public static Decimal fromBigDecimal(BigDecimal bd, int precision, int scale) {
        checkArgument(
                precision >= 1 && precision <= MAX_PRECISION,
                "Decimal precision must be between 1 and %s (both inclusive).",
                MAX_PRECISION);
        checkArgument(
                scale >= 0 && scale <= precision,
                "Decimal scale must be between 0 and the precision %s (both inclusive).",
                precision);

        bd = bd.setScale(scale, RoundingMode.HALF_UP);
        if (bd.precision() > precision) {
            return null;
        }
        return new Decimal(precision, scale, bd);
    }

    /** 由未缩放的 long 值创建,调用方保证 precision 不超过 {@link #MAX_COMPACT_PRECISION}。 */
    public static Decimal fromUnscaledLong(long unscaledLong, int precision, int scale) {
        checkArgument(precision > 0 && precision <= MAX_COMPACT_PRECISION);
        return new Decimal(precision, scale, BigDecimal.valueOf(unscaledLong, scale));
    }

    /** 由未缩放值的二进制补码字节创建。 */
    public static Decimal fromUnscaledBytes(byte[] unscaledBytes, int precision, int scale) {
        return new Decimal(
                precision, scale, new BigDecimal(new BigInteger(unscaledBytes), scale));
    }

    public static boolean isCompact(int precision) {
        return precision <= MAX_COMPACT_PRECISION;
    }

    public int precision() {
        return precision;
    }

    public int scale() {
        return scale;
    }

    public BigDecimal toBigDecimal() {
        return decimalVal;
    }

    public long toUnscaledLong() {
        return decimalVal.unscaledValue().longValueExact();
    }

    public byte[] toUnscaledBytes() {
        return decimalVal.unscaledValue().toByteArray();
    }

    @Override
    public int compareTo(Decimal that) {
        return this.decimalVal.compareTo(that.decimalVal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decimal)) {
            return false;
        }
        Decimal that = (Decimal) o;
        return this.compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        return decimalVal.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return decimalVal.toPlainString();
    }
}
