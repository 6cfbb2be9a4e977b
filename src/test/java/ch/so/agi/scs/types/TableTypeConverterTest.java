package ch.so.agi.scs.types;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import ch.so.agi.scs.model.ScgModelException;

class TableTypeConverterTest {

    @Test
    void defaultTableCoversCommonTypes() {
        TableTypeConverter types = TableTypeConverter.defaults();

        assertEquals(Optional.of("sc_node_tuple"), types.nodeTypeKeyword("node/const/perm/tuple"));
        assertEquals(Optional.of("->"), types.connectorDesignation("arc/const/pos/perm"));
        assertEquals(Optional.of("_->"), types.connectorDesignation("arc/var/pos/perm"));
        assertEquals(Optional.of("<=>"), types.connectorDesignation("pair/const/-/perm/noorient"));
        assertSame(types, TableTypeConverter.defaults());
    }

    @Test
    void unknownOrEmptyTypesYieldNothing() {
        TableTypeConverter types = TableTypeConverter.defaults();

        assertTrue(types.nodeTypeKeyword("node/unknown").isEmpty());
        assertTrue(types.nodeTypeKeyword("").isEmpty());
        assertTrue(types.connectorDesignation(null).isEmpty());
    }

    @Test
    void overridesReplaceAndExtendEntries() {
        TableTypeConverter base = new TableTypeConverter(Map.of("node/a", "sc_node"), Map.of("arc/a", "->"));
        TableTypeConverter merged = base.withOverrides(Map.of("node/a", "sc_node_class", "node/b", "sc_node_tuple"),
                Map.of());

        assertEquals(Optional.of("sc_node_class"), merged.nodeTypeKeyword("node/a"));
        assertEquals(Optional.of("sc_node_tuple"), merged.nodeTypeKeyword("node/b"));
        assertEquals(Optional.of("->"), merged.connectorDesignation("arc/a"));
        assertEquals(Optional.of("sc_node"), base.nodeTypeKeyword("node/a"));
        assertSame(base, base.withOverrides(Map.of(), null));
    }

    @Test
    void parsesTablesAndIgnoresNonStringEntries() {
        TableTypeConverter types = TableTypeConverter.parse(new StringReader(
                "{\"nodeTypes\": {\"n\": \"sc_node\", \"bad\": {\"x\": 1}}, \"connectorTypes\": {\"a\": \"~>\"}}"));

        assertEquals(Optional.of("sc_node"), types.nodeTypeKeyword("n"));
        assertTrue(types.nodeTypeKeyword("bad").isEmpty());
        assertEquals(Optional.of("~>"), types.connectorDesignation("a"));
    }

    @Test
    void malformedTableIsRejected() {
        assertThrows(ScgModelException.class, () -> TableTypeConverter.parse(new StringReader("{\"nodeTypes\": ")));
        assertThrows(ScgModelException.class, () -> TableTypeConverter.parse(new StringReader("[1, 2]")));
    }

    @Test
    void missingResourceFailsLoudly() {
        assertThrows(IllegalStateException.class, () -> TableTypeConverter.load("/no-such-table.json"));
    }
}
