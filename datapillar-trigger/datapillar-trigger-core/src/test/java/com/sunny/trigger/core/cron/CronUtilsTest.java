package com.sunny.trigger.core.cron;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronUtilsTest {

    @Test
    void validate_shouldAcceptFiveAndSixFields() {
        assertTrue(CronUtils.validate("0 * * * *").valid());
        assertTrue(CronUtils.validate("  30 8 * * 1-5 ").valid());
        assertTrue(CronUtils.validate("0 */5 * * * *").valid());
        assertNull(CronUtils.validate("0 * * * *").error());
    }

    @Test
    void validate_shouldRequireExpression() {
        CronValidation validation = CronUtils.validate("   ");

        assertFalse(validation.valid());
        assertEquals("Cron 表达式不能为空", validation.error());
    }

    @Test
    void validate_shouldRejectWrongFieldCountBeforeParsing() {
        // 字段内容本身不合法，但字段数错误应先被报告
        CronValidation tooFew = CronUtils.validate("x y z w");
        CronValidation tooMany = CronUtils.validate("0 0 0 * * * 2025");

        assertEquals("Cron 表达式字段数必须为 5 或 6，实际为 4", tooFew.error());
        assertEquals("Cron 表达式字段数必须为 5 或 6，实际为 7", tooMany.error());
    }

    @Test
    void validate_shouldReportParserError() {
        CronValidation validation = CronUtils.validate("61 * * * *");

        assertFalse(validation.valid());
        assertNotNull(validation.error());
    }

    @Test
    void normalize_shouldPrefixSecondsForFiveFields() {
        assertEquals("0 30 8 * * 1-5", CronUtils.normalize("30 8 * * 1-5"));
        assertEquals("15 30 8 * * *", CronUtils.normalize("15 30 8 * * *"));
    }

    @Test
    void parse_shouldRejectBlank() {
        assertThrows(IllegalArgumentException.class, () -> CronUtils.parse(""));
    }
}
