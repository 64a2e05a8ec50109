package com.pipeline.refinery.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalField;
import java.time.temporal.UnsupportedTemporalTypeException;
import java.util.Objects;

/**
 * 解码后的日期值，可选带时间部分。
 *
 * 除正常的日历日期外，还能表示电子表格序列日期中不存在的 1900-02-29
 * （序列值 60）。该值不是合法的 {@link LocalDate}，因此只暴露年、月、日、时、分、秒字段，
 * 足以按输出模板格式化。
 */
public final class DecodedDate implements TemporalAccessor {

    private final int year;
    private final int month;
    private final int day;
    /** 合法日期；为null表示 1900-02-29 */
    private final LocalDate date;
    /** 时间部分；为null表示只有日期 */
    private final LocalTime time;

    private DecodedDate(int year, int month, int day, LocalDate date, LocalTime time) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.date = date;
        this.time = time;
    }

    public static DecodedDate of(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return new DecodedDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), date, null);
    }

    public static DecodedDate of(LocalDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        LocalDate d = dateTime.toLocalDate();
        return new DecodedDate(d.getYear(), d.getMonthValue(), d.getDayOfMonth(), d, dateTime.toLocalTime());
    }

    /** 电子表格闰年缺陷留下的 1900-02-29 */
    public static DecodedDate spreadsheetLeapDay() {
        return new DecodedDate(1900, 2, 29, null, null);
    }

    public DecodedDate withTime(LocalTime newTime) {
        Objects.requireNonNull(newTime, "newTime");
        return new DecodedDate(year, month, day, date, newTime);
    }

    public DecodedDate withoutTime() {
        return time == null ? this : new DecodedDate(year, month, day, date, null);
    }

    public String format(DateTimeFormatter formatter) {
        return formatter.format(this);
    }

    public boolean hasTime() { return time != null; }
    public boolean isCalendarDate() { return date != null; }
    public int getYear() { return year; }
    public int getMonth() { return month; }
    public int getDay() { return day; }
    public LocalDate getDate() { return date; }
    public LocalTime getTime() { return time; }

    @Override
    public boolean isSupported(TemporalField field) {
        if (field == null) {
            return false;
        }
        if (field.isTimeBased()) {
            return time != null && time.isSupported(field);
        }
        if (date != null) {
            return date.isSupported(field);
        }
        return field == ChronoField.YEAR || field == ChronoField.YEAR_OF_ERA || field == ChronoField.ERA
                || field == ChronoField.MONTH_OF_YEAR || field == ChronoField.DAY_OF_MONTH;
    }

    @Override
    public long getLong(TemporalField field) {
        if (!isSupported(field)) {
            throw new UnsupportedTemporalTypeException("Unsupported field: " + field);
        }
        if (field.isTimeBased()) {
            return time.getLong(field);
        }
        if (date != null) {
            return date.getLong(field);
        }
        if (field == ChronoField.YEAR || field == ChronoField.YEAR_OF_ERA) {
            return year;
        }
        if (field == ChronoField.ERA) {
            return 1;
        }
        return field == ChronoField.MONTH_OF_YEAR ? month : day;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedDate)) return false;
        DecodedDate that = (DecodedDate) o;
        return year == that.year && month == that.month && day == that.day
                && Objects.equals(time, that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day, time);
    }

    @Override
    public String toString() {
        String d = String.format("%04d-%02d-%02d", year, month, day);
        return time == null ? d : d + "T" + time;
    }
}
