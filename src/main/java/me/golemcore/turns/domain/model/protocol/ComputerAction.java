package me.golemcore.turns.domain.model.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Single computer-control action requested by a {@link ComputerCall}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComputerAction.Click.class, name = "click"),
        @JsonSubTypes.Type(value = ComputerAction.DoubleClick.class, name = "double_click"),
        @JsonSubTypes.Type(value = ComputerAction.Drag.class, name = "drag"),
        @JsonSubTypes.Type(value = ComputerAction.Keypress.class, name = "keypress"),
        @JsonSubTypes.Type(value = ComputerAction.Move.class, name = "move"),
        @JsonSubTypes.Type(value = ComputerAction.Screenshot.class, name = "screenshot"),
        @JsonSubTypes.Type(value = ComputerAction.Scroll.class, name = "scroll"),
        @JsonSubTypes.Type(value = ComputerAction.TypeText.class, name = "type"),
        @JsonSubTypes.Type(value = ComputerAction.Wait.class, name = "wait")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ComputerAction {

    Kind kind();

    enum Kind {
        CLICK, DOUBLE_CLICK, DRAG, KEYPRESS, MOVE, SCREENSHOT, SCROLL, TYPE, WAIT
    }

    record Coordinate(int x, int y) {
    }

    record Click(int x, int y, String button) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.CLICK;
        }
    }

    record DoubleClick(int x, int y) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.DOUBLE_CLICK;
        }
    }

    record Drag(List<Coordinate> path) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.DRAG;
        }
    }

    record Keypress(List<String> keys) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.KEYPRESS;
        }
    }

    record Move(int x, int y) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.MOVE;
        }
    }

    record Screenshot() implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.SCREENSHOT;
        }
    }

    record Scroll(int x, int y, int scrollX, int scrollY) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.SCROLL;
        }
    }

    record TypeText(String text) implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.TYPE;
        }
    }

    record Wait() implements ComputerAction {
        @Override
        public Kind kind() {
            return Kind.WAIT;
        }
    }
}
