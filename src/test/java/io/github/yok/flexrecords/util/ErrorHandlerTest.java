package io.github.yok.flexrecords.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("Content load failed (DB=db1)", cause));
            assertEquals("Content load failed (DB=db1)", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("no files"));
            assertEquals("no files", ex2.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("boom", new RuntimeException("root"));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString(StandardCharsets.UTF_8);
        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("root"));
    }

    @Test
    void errorAndExit_正常ケース_復元後にメッセージのみを指定する_例外が送出されないこと() {
        ErrorHandler.disableExitForCurrentThread();
        ErrorHandler.restoreExitForCurrentThread();

        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("boom2");
        } finally {
            System.setErr(originalErr);
        }
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("ERROR: boom2"));
    }

    @Test
    void errorAndExit_正常ケース_入れ子の原因を指定する_最も内側の原因が標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("Content load failed (DB=db1)", new IllegalStateException(
                    "record 'users:bob' could not be written",
                    new SQLException("Duplicate entry 'bob'")));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString(StandardCharsets.UTF_8);
        assertTrue(message.contains("ERROR: Content load failed (DB=db1)"));
        assertTrue(message.contains("SQLException: Duplicate entry 'bob'"));
    }

    @Test
    void errorAndExit_異常ケース_exit無効でメッセージのみを指定する_標準エラーへ出力されないこと() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ErrorHandler.disableExitForCurrentThread();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            assertThrows(IllegalStateException.class, () -> ErrorHandler.errorAndExit("no files"));
        } finally {
            System.setErr(originalErr);
            ErrorHandler.restoreExitForCurrentThread();
        }
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }
}
