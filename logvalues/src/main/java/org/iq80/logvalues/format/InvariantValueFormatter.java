/*
 * Copyright (C) 2011 the original author or authors.
 * See the notice.md file distributed with this work for additional
 * information regarding copyright ownership.
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
package org.iq80.logvalues.format;

import com.google.common.base.Strings;
import org.iq80.logvalues.LogFormatException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Formats values with one fixed convention that does not depend on the default locale or time
 * zone: {@link Locale#ROOT} symbols, {@code '.'} as decimal separator, {@code ','} for grouping
 * and UTC for {@link Date}.
 * <p>
 * Numbers accept the standard specifiers below, where {@code n} is an optional precision:
 * <ul>
 * <li>{@code Dn} integral value, zero-padded to {@code n} digits</li>
 * <li>{@code Fn} fixed point with {@code n} decimals (default 2)</li>
 * <li>{@code Nn} like {@code F} with group separators</li>
 * <li>{@code Pn} value times 100 with a {@code " %"} suffix</li>
 * <li>{@code En} scientific notation, {@code n} decimals (default 6), exponent sign and at least three digits</li>
 * <li>{@code Xn} hexadecimal integral value, upper or lower case after the specifier</li>
 * <li>{@code G}, {@code R} the default representation</li>
 * </ul>
 * Any other numeric specifier is a {@link DecimalFormat} pattern. Temporal values take a
 * {@link DateTimeFormatter} pattern. Specifiers on other values are ignored.
 * Rounding is half away from zero.
 */
public final class InvariantValueFormatter
        implements ValueFormatter
{
    public static final InvariantValueFormatter INSTANCE = new InvariantValueFormatter();

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);
    private static final int DEFAULT_PRECISION = 2;
    private static final int DEFAULT_EXPONENT_PRECISION = 6;
    private static final int MAX_PRECISION = 999;

    private InvariantValueFormatter()
    {
    }

    @Override
    public String format(Object value, String formatString)
    {
        if (value == null) {
            return "";
        }
        if (Strings.isNullOrEmpty(formatString)) {
            return toDefaultString(value);
        }
        if (value instanceof Number) {
            return formatNumber((Number) value, formatString);
        }
        if (value instanceof Date) {
            return formatTemporal(((Date) value).toInstant(), formatString);
        }
        if (value instanceof TemporalAccessor) {
            return formatTemporal((TemporalAccessor) value, formatString);
        }
        return String.valueOf(value);
    }

    private static String toDefaultString(Object value)
    {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        return String.valueOf(value);
    }

    private static String formatTemporal(TemporalAccessor value, String pattern)
    {
        TemporalAccessor temporal = value instanceof Instant ? ((Instant) value).atZone(ZoneOffset.UTC) : value;
        try {
            return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).format(temporal);
        }
        catch (IllegalArgumentException | DateTimeException e) {
            throw new LogFormatException("Invalid date/time format '" + pattern + "' for " + value, e);
        }
    }

    private static String formatNumber(Number number, String formatString)
    {
        if (!isStandardSpecifier(formatString)) {
            return formatPattern(number, formatString);
        }
        char specifier = formatString.charAt(0);
        int precision = formatString.length() > 1 ? parsePrecision(formatString) : -1;
        switch (Character.toUpperCase(specifier)) {
            case 'D':
                return zeroPad(requireIntegral(number, formatString).toString(), precision);
            case 'X':
                String hex = toHexString(number, formatString);
                return zeroPad(specifier == 'X' ? hex.toUpperCase(Locale.ROOT) : hex, precision);
            case 'F':
                return formatDecimal(number, "0", decimals(precision, DEFAULT_PRECISION), "");
            case 'N':
                return formatDecimal(number, "#,##0", decimals(precision, DEFAULT_PRECISION), "");
            case 'P':
                return formatDecimal(number, "#,##0", decimals(precision, DEFAULT_PRECISION), "%");
            case 'E':
                return formatExponent(number, decimals(precision, DEFAULT_EXPONENT_PRECISION), specifier);
            case 'G':
            case 'R':
                return toDefaultString(number);
            default:
                throw new LogFormatException("Unknown format specifier '" + formatString + "'");
        }
    }

    private static boolean isStandardSpecifier(String formatString)
    {
        if (!isAsciiLetter(formatString.charAt(0))) {
            return false;
        }
        for (int i = 1; i < formatString.length(); i++) {
            char c = formatString.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(char c)
    {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static int parsePrecision(String formatString)
    {
        // digits only, checked by isStandardSpecifier
        if (formatString.length() > 4 || Integer.parseInt(formatString.substring(1)) > MAX_PRECISION) {
            throw new LogFormatException("Precision of format specifier '" + formatString + "' is too large");
        }
        return Integer.parseInt(formatString.substring(1));
    }

    private static int decimals(int precision, int defaultPrecision)
    {
        return precision < 0 ? defaultPrecision : precision;
    }

    private static String zeroPad(String digits, int width)
    {
        if (digits.startsWith("-")) {
            return "-" + Strings.padStart(digits.substring(1), width, '0');
        }
        return Strings.padStart(digits, width, '0');
    }

    private static boolean isIntegral(Number number)
    {
        return number instanceof Integer
                || number instanceof Long
                || number instanceof Short
                || number instanceof Byte
                || number instanceof BigInteger
                || number instanceof AtomicInteger
                || number instanceof AtomicLong;
    }

    private static BigInteger requireIntegral(Number number, String formatString)
    {
        if (!isIntegral(number)) {
            throw new LogFormatException("Format specifier '" + formatString + "' requires an integral value but got " + number.getClass().getName());
        }
        return number instanceof BigInteger ? (BigInteger) number : BigInteger.valueOf(number.longValue());
    }

    private static String toHexString(Number number, String formatString)
    {
        requireIntegral(number, formatString);
        if (number instanceof Byte) {
            return Integer.toHexString(number.byteValue() & 0xFF);
        }
        if (number instanceof Short) {
            return Integer.toHexString(number.shortValue() & 0xFFFF);
        }
        if (number instanceof Integer || number instanceof AtomicInteger) {
            return Integer.toHexString(number.intValue());
        }
        if (number instanceof BigInteger) {
            return ((BigInteger) number).toString(16);
        }
        return Long.toHexString(number.longValue());
    }

    private static boolean isNonFinite(Number number)
    {
        return (number instanceof Double && !Double.isFinite(number.doubleValue()))
                || (number instanceof Float && !Float.isFinite(number.floatValue()));
    }

    private static BigDecimal toBigDecimal(Number number)
    {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (number instanceof Float) {
            return new BigDecimal(number.toString());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }

    private static DecimalFormat newDecimalFormat(String pattern)
    {
        DecimalFormat format = new DecimalFormat(pattern, SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format;
    }

    private static String formatDecimal(Number number, String integerPattern, int decimals, String percent)
    {
        if (isNonFinite(number)) {
            return number.toString();
        }
        BigDecimal value = toBigDecimal(number);
        if (!percent.isEmpty()) {
            value = value.movePointRight(2);
        }
        String pattern = decimals == 0 ? integerPattern : integerPattern + "." + Strings.repeat("0", decimals);
        String text = newDecimalFormat(pattern).format(value);
        return percent.isEmpty() ? text : text + " " + percent;
    }

    private static String formatExponent(Number number, int decimals, char specifier)
    {
        if (isNonFinite(number)) {
            return number.toString();
        }
        String pattern = (decimals == 0 ? "0" : "0." + Strings.repeat("0", decimals)) + "E000";
        String text = newDecimalFormat(pattern).format(toBigDecimal(number));
        int exponent = text.indexOf('E');
        if (text.charAt(exponent + 1) != '-') {
            text = text.substring(0, exponent + 1) + "+" + text.substring(exponent + 1);
        }
        return specifier == 'e' ? text.replace('E', 'e') : text;
    }

    private static String formatPattern(Number number, String pattern)
    {
        if (isNonFinite(number)) {
            return number.toString();
        }
        DecimalFormat format;
        try {
            format = newDecimalFormat(pattern);
        }
        catch (IllegalArgumentException e) {
            throw new LogFormatException("Invalid numeric format '" + pattern + "'", e);
        }
        return format.format(toBigDecimal(number));
    }
}
