package io.github.yok.flexrecords.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import com.google.common.util.concurrent.MoreExecutors;
import io.github.yok.flexrecords.db.QueryResult;
import io.github.yok.flexrecords.db.QueryRunner;
import io.github.yok.flexrecords.db.h2.H2Dialect;
import io.github.yok.flexrecords.model.DbReference;
import io.github.yok.flexrecords.model.LocalReference;
import io.github.yok.flexrecords.model.RecordParams;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReferenceResolverTest {

    private static final String ROLE_SELECT = "SELECT \"id\" FROM \"role\" WHERE \"name\" = ?";

    private QueryRunner runner;
    private IdentifierRegistry registry;
    private ExecutorService pool;

    @BeforeEach
    void setup() {
        runner = mock(QueryRunner.class);
        registry = new IdentifierRegistry();
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ReferenceResolver resolver() {
        return new ReferenceResolver(registry,
                new ReferenceLookup(runner, new StatementBuilder(new H2Dialect())), pool);
    }

    @Test
    void resolve_正常ケース_参照を含まない_値がそのまま返却されクエリが発行されないこと() throws Exception {
        RecordParams params = RecordParams.of("name", "Bob", "age", 30, "tags",
                List.of("a", "b"), "settings", Map.of("theme", "dark"));

        Map<String, Object> resolved = resolver().resolve("users", "bob", params);

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("name", "Bob");
        expected.put("age", 30);
        expected.put("tags", List.of("a", "b"));
        expected.put("settings", Map.of("theme", "dark"));
        assertEquals(expected, resolved);
        assertEquals(List.of("name", "age", "tags", "settings"),
                List.copyOf(resolved.keySet()));
        verifyNoInteractions(runner);
    }

    @Test
    void resolve_正常ケース_入れ子のローカル参照を指定する_構造を保って解決されること() throws Exception {
        registry.register("company", "acme", 5);
        RecordParams params = RecordParams.of("owner", new LocalReference("company", "acme"),
                "settings", RecordParams.of("parent", new LocalReference("company", "acme")),
                "links", List.of(new LocalReference("company", "acme"), "x"));

        Map<String, Object> resolved = resolver().resolve("users", "bob", params);

        assertEquals(5, resolved.get("owner"));
        assertEquals(Map.of("parent", 5), resolved.get("settings"));
        assertEquals(List.of(5, "x"), resolved.get("links"));
    }

    @Test
    void resolve_正常ケース_未登録のローカル参照を指定する_nullになり診断が記録されること() throws Exception {
        RecordParams params = RecordParams.of("name", "Bob", "settings",
                RecordParams.of("owner", new LocalReference("company", "ghost")), "tags",
                List.of("a", new LocalReference("tag", "missing")));

        ReferenceResolver resolver = resolver();
        Map<String, Object> resolved = resolver.resolve("users", "bob", params);

        assertEquals("Bob", resolved.get("name"));
        Map<?, ?> settings = (Map<?, ?>) resolved.get("settings");
        assertTrue(settings.containsKey("owner"));
        assertNull(settings.get("owner"));
        assertEquals(Arrays.asList("a", null), resolved.get("tags"));

        List<ResolutionDiagnostic> diagnostics = resolver.getDiagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals("settings.owner", diagnostics.get(0).getField());
        assertEquals("users", diagnostics.get(0).getTable());
        assertEquals("bob", diagnostics.get(0).getLocalId());
        assertEquals(new LocalReference("company", "ghost"), diagnostics.get(0).getReference());
        assertEquals("tags[1]", diagnostics.get(1).getField());
    }

    @Test
    void resolve_正常ケース_DB参照を指定する_検索結果の識別子に置換されること() throws Exception {
        when(runner.query(ROLE_SELECT, List.of("admin")))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 3))));

        Map<String, Object> resolved = resolver().resolve("users", "bob", RecordParams.of("roleId",
                new DbReference("role", List.of("name"), List.of("id"), List.of("admin"))));

        assertEquals(3, resolved.get("roleId"));
    }

    @Test
    void resolve_正常ケース_入れ子のDB参照を複数指定する_内側を解決してから外側を検索すること() throws Exception {
        when(runner.query(eq("SELECT \"id\" FROM \"company\" WHERE \"name\" = ?"), anyList()))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 10))));
        when(runner.query(eq(ROLE_SELECT), anyList()))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 20))));
        when(runner.query(eq("SELECT \"id\" FROM \"grant\" WHERE \"companyId\" = ? AND "
                + "\"roleId\" = ? AND \"level\" = ?"), eq(List.of(10, 20, 1))))
                        .thenReturn(QueryResult.ofRows(List.of(row("id", 99))));

        DbReference company =
                new DbReference("company", List.of("name"), List.of("id"), List.of("Acme"));
        DbReference role =
                new DbReference("role", List.of("name"), List.of("id"), List.of("admin"));
        DbReference grant = new DbReference("grant", List.of("companyId", "roleId", "level"),
                List.of("id"), List.of(company, role, 1));

        assertEquals(99, resolver().resolveDbReference(grant));
        verify(runner, times(3)).query(anyString(), anyList());
    }

    @Test
    void resolve_正常ケース_DB参照の値にローカル参照を指定する_登録済み識別子で検索されること() throws Exception {
        registry.register("company", "acme", 5);
        when(runner.query(eq("SELECT \"id\" FROM \"users\" WHERE \"companyId\" = ?"),
                eq(List.of(5)))).thenReturn(QueryResult.ofRows(List.of(row("id", 8))));

        Object id = resolver().resolveDbReference(new DbReference("users", List.of("companyId"),
                List.of("id"), List.of(new LocalReference("company", "acme"))));
        assertEquals(8, id);
    }

    @Test
    void resolve_異常ケース_DB参照が見つからない_REFERENCE_NOT_FOUNDが送出されること() throws Exception {
        when(runner.query(anyString(), anyList())).thenReturn(QueryResult.empty());

        RecordInsertException ex = assertThrows(RecordInsertException.class,
                () -> resolver().resolve("users", "bob", RecordParams.of("roleId",
                        new DbReference("role", List.of("name"), List.of("id"),
                                List.of("ghost")))));
        assertEquals(ErrorKind.REFERENCE_NOT_FOUND, ex.getKind());
        assertEquals("role", ex.getTable());
        assertEquals("role:ghost", ex.getIdentifier());
        assertTrue(ex.getMessage().contains("could not be found"));
    }

    @Test
    void resolve_異常ケース_検索クエリが失敗する_REFERENCE_LOOKUP_FAILEDが送出されること() throws Exception {
        SQLException cause = new SQLException("connection lost");
        when(runner.query(anyString(), anyList())).thenThrow(cause);

        RecordInsertException ex = assertThrows(RecordInsertException.class,
                () -> resolver().resolveDbReference(new DbReference("role", List.of("name"),
                        List.of("id"), List.of("admin"))));
        assertEquals(ErrorKind.REFERENCE_LOOKUP_FAILED, ex.getKind());
        assertEquals(cause, ex.getCause());
    }

    @Test
    void resolveAll_正常ケース_複数の参照を指定する_同じキーで識別子が返却されること() throws Exception {
        when(runner.query(ROLE_SELECT, List.of("admin")))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 1))));
        when(runner.query(ROLE_SELECT, List.of("guest")))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 2))));

        Map<String, DbReference> refs = new LinkedHashMap<>();
        refs.put("adminRole",
                new DbReference("role", List.of("name"), List.of("id"), List.of("admin")));
        refs.put("guestRole",
                new DbReference("role", List.of("name"), List.of("id"), List.of("guest")));

        Map<String, Object> ids = resolver().resolveAll(refs);
        assertEquals(List.of("adminRole", "guestRole"), List.copyOf(ids.keySet()));
        assertEquals(1, ids.get("adminRole"));
        assertEquals(2, ids.get("guestRole"));
    }

    @Test
    void resolveAll_異常ケース_一部が見つからない_反復順で最初の失敗が送出されること() throws Exception {
        when(runner.query(ROLE_SELECT, List.of("a"))).thenReturn(QueryResult.empty());
        when(runner.query(ROLE_SELECT, List.of("b")))
                .thenThrow(new SQLException("b failed"));

        Map<String, DbReference> refs = new LinkedHashMap<>();
        refs.put("a", new DbReference("role", List.of("name"), List.of("id"), List.of("a")));
        refs.put("b", new DbReference("role", List.of("name"), List.of("id"), List.of("b")));

        RecordInsertException ex =
                assertThrows(RecordInsertException.class, () -> resolver().resolveAll(refs));
        assertEquals(ErrorKind.REFERENCE_NOT_FOUND, ex.getKind());
        verify(runner, times(2)).query(anyString(), anyList());
    }

    @Test
    void resolveAll_正常ケース_2スレッドで多段の入れ子参照を指定する_停止せずに解決されること() throws Exception {
        when(runner.query(anyString(), anyList()))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 1))));
        ExecutorService small = Executors.newFixedThreadPool(2);
        try {
            ReferenceResolver resolver = new ReferenceResolver(registry,
                    new ReferenceLookup(runner, new StatementBuilder(new H2Dialect())), small);
            Map<String, DbReference> refs = new LinkedHashMap<>();
            refs.put("k1", chain(2));
            refs.put("k2", chain(2));

            Map<String, Object> ids = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> resolver.resolveAll(refs));

            assertEquals(Map.of("k1", 1, "k2", 1), ids);
            verify(runner, times(14)).query(anyString(), anyList());
        } finally {
            small.shutdownNow();
        }
    }

    @Test
    void resolve_正常ケース_1スレッドで3段の入れ子参照を指定する_停止せずに解決されること() throws Exception {
        when(runner.query(anyString(), anyList()))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 4))));
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ReferenceResolver resolver = new ReferenceResolver(registry,
                    new ReferenceLookup(runner, new StatementBuilder(new H2Dialect())), single);
            RecordParams params = RecordParams.of("name", "Bob", "grantId", chain(3));

            Map<String, Object> resolved = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> resolver.resolve("users", "bob", params));

            assertEquals(4, resolved.get("grantId"));
            verify(runner, times(15)).query(anyString(), anyList());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void resolveDbReference_異常ケース_内側の参照が見つからない_外側の検索が行われないこと() throws Exception {
        when(runner.query(eq("SELECT \"id\" FROM \"company\" WHERE \"name\" = ?"), anyList()))
                .thenReturn(QueryResult.empty());
        when(runner.query(eq(ROLE_SELECT), anyList()))
                .thenReturn(QueryResult.ofRows(List.of(row("id", 20))));

        DbReference grant = new DbReference("grant", List.of("companyId", "roleId"),
                List.of("id"),
                List.of(new DbReference("company", List.of("name"), List.of("id"),
                        List.of("Ghost")),
                        new DbReference("role", List.of("name"), List.of("id"),
                                List.of("admin"))));

        RecordInsertException ex = assertThrows(RecordInsertException.class,
                () -> resolver().resolveDbReference(grant));
        assertEquals(ErrorKind.REFERENCE_NOT_FOUND, ex.getKind());
        assertEquals("company", ex.getTable());
        verify(runner, times(2)).query(anyString(), anyList());
    }

    @Test
    void awaitAll_正常ケース_空のリストを指定する_空のリストが返却されること() throws Exception {
        assertTrue(ReferenceResolver.awaitAll(List.of()).isEmpty());
    }

    @Test
    void awaitAll_正常ケース_同期実行の結果を指定する_順序通りに返却されること() throws Exception {
        List<CompletableFuture<Object>> futures =
                List.of(CompletableFuture.<Object>supplyAsync(() -> "x",
                        MoreExecutors.directExecutor()), CompletableFuture.<Object>completedFuture(2));
        assertEquals(List.of("x", 2), ReferenceResolver.awaitAll(futures));
    }

    // A reference whose match values are two references one level down, ending in leaf lookups
    private static DbReference chain(int depth) {
        if (depth == 0) {
            return new DbReference("leaf", List.of("name"), List.of("id"), List.of("v"));
        }
        return new DbReference("level" + depth, List.of("a", "b"), List.of("id"),
                List.of(chain(depth - 1), chain(depth - 1)));
    }

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put(column, value);
        return r;
    }
}
