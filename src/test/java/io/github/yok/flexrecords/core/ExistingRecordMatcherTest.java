package io.github.yok.flexrecords.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexrecords.db.QueryResult;
import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.db.postgresql.PostgresqlDialect;
import io.github.yok.flexrecords.model.ExistingMode;
import io.github.yok.flexrecords.model.TableOptions;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExistingRecordMatcherTest {

    private QueryRunner runner;
    private ExistingRecordMatcher matcher;

    @BeforeEach
    void setup() {
        runner = mock(QueryRunner.class);
        matcher = new ExistingRecordMatcher(
                new ReferenceLookup(runner, new StatementBuilder(new PostgresqlDialect())));
    }

    @Test
    void findExisting_正常ケース_一致行がある_識別子が返却されること() throws Exception {
        when(runner.query("SELECT \"id\" FROM \"company\" WHERE \"name\" = ?", List.of("Acme")))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 7))));

        Optional<Object> id = matcher.findExisting("company", "acme",
                TableOptions.matching(ExistingMode.UPDATE, "id", "name"),
                record("name", "Acme", "country", "JP"));
        assertEquals(Optional.of(7), id);
    }

    @Test
    void findExisting_正常ケース_一致行がない_空が返却されること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.empty());

        assertEquals(Optional.empty(), matcher.findExisting("company", "acme",
                TableOptions.matching(ExistingMode.UPDATE, "id", "name"), record("name", "X")));
    }

    @Test
    void findExisting_正常ケース_複合識別子を指定する_列名と値のMapが返却されること() throws Exception {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put("orgId", 1);
        r.put("userId", 2);
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.ofRows(List.of(r)));

        TableOptions options = new TableOptions(List.of("name"), List.of("orgId", "userId"),
                ExistingMode.REPLACE);
        Optional<Object> id =
                matcher.findExisting("membership", "m1", options, record("name", "owner"));

        assertEquals(Optional.of(Map.of("orgId", 1, "userId", 2)), id);
        verify(runner).query(
                "SELECT \"orgId\", \"userId\" FROM \"membership\" WHERE \"name\" = ?",
                List.of("owner"));
    }

    @Test
    void findExisting_正常ケース_一致列が欠けている_nullがバインドされること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.empty());

        TableOptions options =
                new TableOptions(List.of("name", "code"), null, ExistingMode.UPDATE);
        matcher.findExisting("company", "acme", options, record("name", "Acme"));

        verify(runner).query("SELECT \"id\" FROM \"company\" WHERE \"name\" = ? AND \"code\" = ?",
                Arrays.asList("Acme", null));
    }

    @Test
    void findExisting_正常ケース_一致列が入れ子の値である_JSON文字列がバインドされること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.empty());

        matcher.findExisting("settings", "s1",
                TableOptions.matching(ExistingMode.UPDATE, "id", "payload"),
                record("payload", Map.of("k", "v")));

        verify(runner).query("SELECT \"id\" FROM \"settings\" WHERE \"payload\" = ?",
                List.of("{\"k\":\"v\"}"));
    }

    @Test
    void findExisting_異常ケース_クエリが失敗する_REFERENCE_LOOKUP_FAILEDが送出されること() throws Exception {
        when(runner.query(anyString(), anyList())).thenThrow(new SQLException("timeout"));

        RecordInsertException ex = assertThrows(RecordInsertException.class,
                () -> matcher.findExisting("company", "acme",
                        TableOptions.matching(ExistingMode.UPDATE, "id", "name"),
                        record("name", "Acme")));
        assertEquals(ErrorKind.REFERENCE_LOOKUP_FAILED, ex.getKind());
        assertEquals("company", ex.getTable());
        assertEquals("acme", ex.getIdentifier());
    }

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put(column, value);
        return r;
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> r = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            r.put((String) keyValues[i], keyValues[i + 1]);
        }
        return r;
    }
}
