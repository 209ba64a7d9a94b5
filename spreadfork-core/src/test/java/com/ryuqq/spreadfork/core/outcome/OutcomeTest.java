package com.ryuqq.spreadfork.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome (Ok / Retry / Fail) 테스트.
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_WithValue_OnlyIsOkTrue() {
        // When
        Outcome<String> outcome = Ok.of("create_fork", "fork-1");

        // Then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isRetry());
        assertFalse(outcome.isFail());
        assertEquals("fork-1", outcome.valueOrNull());
    }

    @Test
    void ok_NullValue_Allowed() {
        // When
        Ok<Void> ok = Ok.of("discard_fork", null);

        // Then
        assertNull(ok.value());
        assertEquals("discard_fork", ok.operation());
    }

    @Test
    void ok_BlankOperation_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Ok.of(" ", "x")
        );
        assertTrue(exception.getMessage().contains("operation cannot be null or blank"));
    }

    @Test
    void retry_VersionConflict_CarriesCurrentVersion() {
        // When
        Outcome<String> outcome = new Retry<>("edit_fork", "VERSION_CONFLICT", "stale version", 7L);

        // Then
        assertTrue(outcome.isRetry());
        assertNull(outcome.valueOrNull());
        assertEquals(7L, ((Retry<String>) outcome).currentVersion());
    }

    @Test
    void retry_LockTimeout_NullVersionAllowed() {
        // When
        Retry<String> retry = new Retry<>("edit_fork", "LOCK_TIMEOUT", "busy", null);

        // Then
        assertNull(retry.currentVersion());
    }

    @Test
    void retry_NegativeVersion_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Retry<>("edit_fork", "VERSION_CONFLICT", "stale", -1L)
        );
        assertTrue(exception.getMessage().contains("currentVersion must be non-negative"));
    }

    @Test
    void retry_BlankReason_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Retry<>("edit_fork", "VERSION_CONFLICT", "  ", 1L));
    }

    @Test
    void fail_Of_CauseIsNull() {
        // When
        Fail<String> fail = Fail.of("get_fork", "NOT_FOUND", "fork not found: fork-1");

        // Then
        assertTrue(fail.isFail());
        assertNull(fail.cause());
        assertEquals("NOT_FOUND", fail.errorCode());
    }

    @Test
    void fail_NullErrorCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Fail<>("get_fork", null, "message", null)
        );
        assertTrue(exception.getMessage().contains("errorCode"));
    }
}
