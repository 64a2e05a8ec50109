package com.pipeline.refinery.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * 电子表格序列日期解码规则。
 *
 * 序列值是自 1900 年纪元起的天数，沿用电子表格把 1900 年当作闰年的历史缺陷：
 * <ul>
 *   <li>1..59 对应 1900-01-01..1900-02-28</li>
 *   <li>60 对应不存在的 1900-02-29</li>
 *   <li>61 起对应 1900-03-01 及以后</li>
 * </ul>
 * 小数部分（一天以内的时间）直接舍弃，只输出日期。
 */
public final class SerialDateFormatRule extends FormatRule {

    /** 序列值 60 之前使用的纪元 */
    private static final LocalDate EARLY_EPOCH = LocalDate.of(1899, 12, 31);
    /** 序列值 60 之后使用的纪元，吸收了虚构的 2 月 29 日 */
    private static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    private static final long PHANTOM_LEAP_DAY = 60;
    /** 9999-12-31 */
    private static final long MAX_SERIAL = 2_958_465;

    public SerialDateFormatRule(String name, String regex, String description) {
        super(name, regex, description);
    }

    @Override
    public DecodedDate decode(String value) {
        long serial;
        try {
            serial = new BigDecimal(value.trim()).setScale(0, RoundingMode.FLOOR).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
        return fromSerial(serial);
    }

    /**
     * 把整数序列值换算为日期
     *
     * @return 日期；序列值为负或超出 9999-12-31 时返回null
     */
    public static DecodedDate fromSerial(long serial) {
        if (serial < 0 || serial > MAX_SERIAL) {
            return null;
        }
        if (serial == PHANTOM_LEAP_DAY) {
            return DecodedDate.spreadsheetLeapDay();
        }
        LocalDate base = serial < PHANTOM_LEAP_DAY ? EARLY_EPOCH : EPOCH;
        return DecodedDate.of(base.plusDays(serial));
    }

    @Override
    public Kind getKind() {
        return Kind.SERIAL_NUMBER;
    }
}
