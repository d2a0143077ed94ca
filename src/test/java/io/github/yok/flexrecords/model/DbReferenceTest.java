package io.github.yok.flexrecords.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import org.junit.jupiter.api.Test;

class DbReferenceTest {

    @Test
    void constructor_正常ケース_ネストした参照を指定する_値がRecordValueに変換されること() {
        DbReference inner = new DbReference("company", List.of("name"), List.of("id"),
                List.of("Acme"));
        DbReference outer = new DbReference("users", List.of("companyId", "name"),
                List.of("id"), List.of(inner, "Bob"));

        assertEquals(RecordValue.Kind.DB_REF, outer.getMatchValues().get(0).getKind());
        assertEquals(RecordValue.scalar("Bob"), outer.getMatchValues().get(1));
        assertFalse(outer.isComposite());
    }

    @Test
    void constructor_異常ケース_値の数が列数と異なる_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new DbReference("role", List.of("name", "scope"), List.of("id"),
                        List.of("admin")));
        assertTrue(ex.getMessage().contains("expects 2 match value(s)"));
    }

    @Test
    void constructor_異常ケース_列が空である_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new DbReference("role", List.of(), List.of("id"), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new DbReference("role", List.of("name"), List.of(), List.of("x")));
    }

    @Test
    void isComposite_正常ケース_識別子列が2列である_trueが返却されること() {
        DbReference ref = new DbReference("membership", List.of("name"),
                List.of("orgId", "userId"), List.of("x"));
        assertTrue(ref.isComposite());
    }

    @Test
    void toString_正常ケース_スカラー値を持つ_テーブルと値が表示されること() {
        DbReference ref = new DbReference("role", List.of("name", "scope"), List.of("id"),
                List.of("admin", 3));
        assertEquals("role:admin,3", ref.toString());
    }
}
