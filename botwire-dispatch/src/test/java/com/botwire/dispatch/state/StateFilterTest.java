package com.botwire.dispatch.state;

import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.errors.ConfigurationException;
import com.botwire.dispatch.TestUpdates;
import com.botwire.dispatch.filter.FilterRegistry;
import com.botwire.dispatch.filter.FilterSpec;
import com.botwire.dispatch.filter.Filters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateFilterTest {

    private final StateStorage storage = new MemoryStateStorage();
    private final FilterRegistry registry = new FilterRegistry();

    @BeforeEach
    void setUp() {
        registry.registerCustomFilter(new StateFilter(storage));
    }

    private boolean matches(FilterSpec spec, Update update) {
        return registry.resolve(update.getKind(), spec).test(update);
    }

    @Test
    void singleState_matchesOnlyThatState() {
        // TestUpdates messages come from user 500 in chat 42.
        storage.setState(42, 500, "ask_name");

        assertTrue(matches(Filters.state("ask_name"), TestUpdates.text(1, "Ann")));
        assertFalse(matches(Filters.state("ask_age"), TestUpdates.text(2, "Ann")));
    }

    @Test
    void listOfStates_matchesAny() {
        storage.setState(42, 500, "ask_age");

        assertTrue(matches(Filters.state("ask_name", "ask_age"), TestUpdates.text(1, "30")));
    }

    @Test
    void noState_noMatch_exceptWildcard() {
        assertFalse(matches(Filters.state("ask_name"), TestUpdates.text(1, "x")));
        assertTrue(matches(Filters.state(StateFilter.ANY), TestUpdates.text(2, "x")));
    }

    @Test
    void otherUserInSameChat_doesNotShareState() {
        storage.setState(42, 501, "ask_name");

        assertFalse(matches(Filters.state("ask_name"), TestUpdates.text(1, "x")));
    }

    @Test
    void callbackQuery_usesMessageChatAndSender() {
        storage.setState(42, 500, "menu");

        assertTrue(matches(Filters.state("menu"), TestUpdates.callback(1, "open")));
    }

    @Test
    void badArgument_rejectedAtResolution() {
        assertThrows(ConfigurationException.class,
                () -> registry.resolve(UpdateKind.MESSAGE, Filters.custom("state", 3)));
        assertThrows(ConfigurationException.class,
                () -> registry.resolve(UpdateKind.MESSAGE, Filters.custom("state", List.of())));
    }
}
