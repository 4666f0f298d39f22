package io.github.yok.sentilink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.sentilink.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link StoreKind} and {@link ExistsPolicy}.
 */
class StoreKindTest {

    @Test
    void fromAlias_正常ケース_別名から種別が解決されること() {
        assertEquals(StoreKind.DELIMITED_FILE, StoreKind.fromAlias("csv"));
        assertEquals(StoreKind.STRUCTURED_FILE, StoreKind.fromAlias(" JSON "));
        assertEquals(StoreKind.RELATIONAL, StoreKind.fromAlias("db"));
        assertEquals(StoreKind.RELATIONAL, StoreKind.fromAlias("postgres"));
        assertEquals(StoreKind.RELATIONAL, StoreKind.fromAlias("mysql"));
    }

    @Test
    void fromAlias_異常ケース_未知の別名_ConfigurationExceptionが送出されること() {
        ConfigurationException ex =
                assertThrows(ConfigurationException.class, () -> StoreKind.fromAlias("xml"));
        assertTrue(ex.getMessage().contains("xml"));
        assertThrows(ConfigurationException.class, () -> StoreKind.fromAlias(null));
    }

    @Test
    void isFile_正常ケース_ファイル種別のみtrueとなること() {
        assertTrue(StoreKind.DELIMITED_FILE.isFile());
        assertTrue(StoreKind.STRUCTURED_FILE.isFile());
        assertFalse(StoreKind.RELATIONAL.isFile());
    }

    @Test
    void parse_正常ケース_大文字小文字を区別せずに解決されること() {
        assertEquals(ExistsPolicy.APPEND, ExistsPolicy.parse("append"));
        assertEquals(ExistsPolicy.REPLACE, ExistsPolicy.parse("Replace"));
        assertEquals(ExistsPolicy.FAIL, ExistsPolicy.parse("FAIL"));
    }

    @Test
    void parse_異常ケース_未知のポリシー_ConfigurationExceptionが送出されること() {
        ConfigurationException ex =
                assertThrows(ConfigurationException.class, () -> ExistsPolicy.parse("upsert"));
        assertTrue(ex.getMessage().contains("upsert"));
        assertThrows(ConfigurationException.class, () -> ExistsPolicy.parse(" "));
    }
}
