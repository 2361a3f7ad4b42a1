package me.golemcore.turns.adapter.outbound.session;

import me.golemcore.turns.domain.model.protocol.ModelItem;
import me.golemcore.turns.domain.model.protocol.ModelMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySessionAdapterTest {

    private static final String SESSION_ID = "sess-1";

    private InMemorySessionAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemorySessionAdapter();
    }

    @Test
    void shouldAppendItemsInOrder() {
        ModelItem first = ModelMessage.user("one");
        ModelItem second = ModelMessage.assistant("msg_2", "two");

        adapter.addItems(SESSION_ID, List.of(first));
        adapter.addItems(SESSION_ID, List.of(second));

        assertEquals(List.of(first, second), adapter.getItems(SESSION_ID));
    }

    @Test
    void shouldReturnEmptyListForUnknownSession() {
        assertTrue(adapter.getItems("missing").isEmpty());
    }

    @Test
    void shouldReturnSnapshotCopy() {
        adapter.addItems(SESSION_ID, List.of(ModelMessage.user("one")));

        List<ModelItem> items = adapter.getItems(SESSION_ID);

        assertThrows(UnsupportedOperationException.class, () -> items.add(ModelMessage.user("two")));
        assertEquals(1, adapter.getItems(SESSION_ID).size());
    }

    @Test
    void shouldClearSession() {
        adapter.addItems(SESSION_ID, List.of(ModelMessage.user("one")));

        adapter.clear(SESSION_ID);

        assertTrue(adapter.getItems(SESSION_ID).isEmpty());
    }
}
