package io.github.yok.flexrecords.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.flexrecords.db.QueryResult;
import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.db.mysql.MySqlDialect;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordWriterTest {

    private QueryRunner runner;
    private RecordWriter writer;

    @BeforeEach
    void setup() {
        runner = mock(QueryRunner.class);
        writer = new RecordWriter(runner, new StatementBuilder(new MySqlDialect()));
    }

    @Test
    void databaseInsert_正常ケース_生成キーが返る_識別子が返却されること() throws Exception {
        when(runner.query("INSERT INTO `users` (`name`, `companyId`) VALUES (?, ?)",
                List.of("Bob", 5))).thenReturn(QueryResult.ofWrite(1, 42L));

        assertEquals(42L, writer.databaseInsert("users", record("name", "Bob", "companyId", 5)));
    }

    @Test
    void databaseInsert_正常ケース_入れ子の値を指定する_JSON文字列がバインドされること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.ofWrite(1, null));

        Object id = writer.databaseInsert("settings",
                record("payload", Map.of("owner", 5), "tags", List.of("a", "b")));

        assertNull(id);
        verify(runner).query("INSERT INTO `settings` (`payload`, `tags`) VALUES (?, ?)",
                List.of("{\"owner\":5}", "[\"a\",\"b\"]"));
    }

    @Test
    void databaseUpdate_正常ケース_列を指定する_識別子がWHERE句にバインドされること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.ofWrite(1, null));

        writer.databaseUpdate("company", List.of("id"), 7, record("name", "Acme", "country", "JP"));

        verify(runner).query("UPDATE `company` SET `name` = ?, `country` = ? WHERE `id` = ?",
                List.of("Acme", "JP", 7));
    }

    @Test
    void databaseUpdate_正常ケース_列が空である_文が発行されないこと() throws Exception {
        writer.databaseUpdate("company", List.of("id"), 7, new LinkedHashMap<>());
        verifyNoInteractions(runner);
    }

    @Test
    void databaseReplace_正常ケース_識別子列がない_識別子列が追加されること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.ofWrite(2, null));

        writer.databaseReplace("company", List.of("id"), 7, record("name", "Acme"));

        verify(runner).query("REPLACE INTO `company` (`name`, `id`) VALUES (?, ?)",
                List.of("Acme", 7));
    }

    @Test
    void databaseReplace_正常ケース_複合識別子列を含む_一致した識別子がバインドされること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.ofWrite(2, null));

        writer.databaseReplace("membership", List.of("orgId", "userId"),
                Map.of("orgId", 1, "userId", 2), record("userId", 99, "role", "admin"));

        verify(runner).query(
                "REPLACE INTO `membership` (`userId`, `role`, `orgId`) VALUES (?, ?, ?)",
                List.of(2, "admin", 1));
    }

    @Test
    void databaseDelete_正常ケース_一致行を削除する_削除件数が返却されること() throws Exception {
        when(runner.query("DELETE FROM `role` WHERE `name` = ?", List.of("old")))
                .thenReturn(QueryResult.ofWrite(3, null));

        assertEquals(3, writer.databaseDelete("role", List.of("name"), List.of("old")));
    }

    @Test
    void databaseDelete_異常ケース_値の数が列数と異なる_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> writer.databaseDelete("role", List.of("name"), List.of("a", "b")));
        verifyNoInteractions(runner);
    }

    @Test
    void databaseInsert_異常ケース_文が失敗する_WRITE_FAILEDが送出されること() throws Exception {
        SQLException cause = new SQLException("duplicate key");
        when(runner.query(anyString(), anyList())).thenThrow(cause);

        RecordInsertException ex = assertThrows(RecordInsertException.class,
                () -> writer.databaseInsert("users", record("name", "Bob")));
        assertEquals(ErrorKind.WRITE_FAILED, ex.getKind());
        assertEquals("users", ex.getTable());
        assertEquals(cause, ex.getCause());
    }

    @Test
    void idValues_異常ケース_複合識別子がMapでない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> RecordWriter.idValues(List.of("orgId", "userId"), 5));
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> r = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            r.put((String) keyValues[i], keyValues[i + 1]);
        }
        return r;
    }
}
