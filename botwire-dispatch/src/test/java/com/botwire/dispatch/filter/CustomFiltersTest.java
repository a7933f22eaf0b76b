package com.botwire.dispatch.filter;

import com.botwire.api.binding.BotJson;
import com.botwire.api.client.BotApi;
import com.botwire.api.transport.BotTransport;
import com.botwire.api.transport.InputFile;
import com.botwire.api.types.InlineQuery;
import com.botwire.api.types.Message;
import com.botwire.api.types.Poll;
import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.errors.ConfigurationException;
import com.botwire.dispatch.TestUpdates;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CustomFiltersTest {

    private FilterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FilterRegistry();
        CustomFilters.registerDefaults(registry);
    }

    private boolean matches(String key, Object value, Update update) {
        return registry.resolve(update.getKind(), Filters.custom(key, value)).test(update);
    }

    @Nested
    class Text {
        @Test
        void exactAndListForms() {
            assertTrue(matches("text", "hello", TestUpdates.text(1, "hello")));
            assertFalse(matches("text", "hello", TestUpdates.text(2, "hello!")));
            assertTrue(matches("text", List.of("yes", "no"), TestUpdates.text(3, "no")));
        }

        @Test
        void textFilterModesAreAlternatives() {
            TextFilter filter = TextFilter.builder()
                    .startsWith(List.of("hi"))
                    .endsWith(List.of("bye"))
                    .ignoreCase(true)
                    .build();

            assertTrue(matches("text", filter, TestUpdates.text(1, "Hi there")));
            assertTrue(matches("text", filter, TestUpdates.text(2, "ok, BYE")));
            assertFalse(matches("text", filter, TestUpdates.text(3, "hello")));
        }

        @Test
        void textFilterReadsCaptionsCallbacksQueriesAndPolls() {
            TextFilter filter = TextFilter.builder().contains(List.of("menu")).build();
            InlineQuery q = new InlineQuery();
            q.setQuery("open menu");
            Poll poll = new Poll();
            poll.setQuestion("Which menu?");

            assertTrue(filter.check(TestUpdates.photo(1, "the menu")));
            assertTrue(filter.check(TestUpdates.callback(2, "menu:open")));
            assertTrue(filter.check(Update.of(3, UpdateKind.INLINE_QUERY, q)));
            assertTrue(filter.check(Update.of(4, UpdateKind.POLL, poll)));
        }

        @Test
        void textFilterNeedsAMode() {
            assertThrows(ConfigurationException.class, () -> TextFilter.builder().ignoreCase(true).build());
        }

        @Test
        void containsAndStartsWith() {
            assertTrue(matches("text_contains", List.of("price", "cost"), TestUpdates.text(1, "what does it cost")));
            assertFalse(matches("text_contains", "price", TestUpdates.text(2, "hello")));
            assertTrue(matches("text_startswith", "Sir", TestUpdates.text(3, "Sir, yes")));
            assertThrows(ConfigurationException.class,
                    () -> registry.resolve(UpdateKind.MESSAGE, Filters.custom("text_startswith", 5)));
        }

        @Test
        void isDigit() {
            assertTrue(matches("is_digit", true, TestUpdates.text(1, "12345")));
            assertFalse(matches("is_digit", true, TestUpdates.text(2, "12a")));
            assertFalse(matches("is_digit", true, TestUpdates.text(3, "")));
        }
    }

    @Nested
    class ChatAndSender {
        @Test
        void chatId() {
            assertTrue(matches("chat_id", List.of(1, 42), TestUpdates.text(1, "x")));
            assertTrue(matches("chat_id", 42L, TestUpdates.text(2, "x")));
            assertFalse(matches("chat_id", List.of(7), TestUpdates.text(3, "x")));
            assertThrows(ConfigurationException.class,
                    () -> registry.resolve(UpdateKind.MESSAGE, Filters.custom("chat_id", List.of("42"))));
        }

        @Test
        void languageCode() {
            assertTrue(matches("language_code", "en", TestUpdates.text(1, "x")));
            assertTrue(matches("language_code", List.of("ru", "en"), TestUpdates.text(2, "x")));
            assertFalse(matches("language_code", "de", TestUpdates.text(3, "x")));
        }

        @Test
        void forwardedAndReply() {
            Message m = TestUpdates.message(42, "private", "fwd");
            m.setForwardDate(1_700_000_000L);
            m.setReplyToMessage(TestUpdates.message(42, "private", "original"));
            Update forwardedReply = Update.message(1, m);

            assertTrue(matches("is_forwarded", true, forwardedReply));
            assertTrue(matches("is_reply", true, forwardedReply));
            assertTrue(matches("is_forwarded", false, TestUpdates.text(2, "plain")));
            assertFalse(matches("is_reply", true, TestUpdates.text(3, "plain")));
        }

        @Test
        void chatAdminAsksTheApi() {
            var transport = new StatusTransport("administrator");
            registry.registerCustomFilter(new CustomFilters.IsChatAdmin(new BotApi(transport)));

            assertTrue(matches("is_chat_admin", true, TestUpdates.text(1, "x")));
            assertEquals(42L, transport.lastParams.get("chat_id"));
            assertEquals(500L, transport.lastParams.get("user_id"));

            transport.status = "member";
            assertFalse(matches("is_chat_admin", true, TestUpdates.text(2, "x")));
        }
    }

    /** Answers getChatMember with a fixed status. */
    static class StatusTransport implements BotTransport {
        String status;
        Map<String, Object> lastParams;

        StatusTransport(String status) {
            this.status = status;
        }

        @Override
        public List<JsonNode> fetchUpdates(long offset, int timeoutSeconds, int limit, List<String> allowedUpdates) {
            return List.of();
        }

        @Override
        public JsonNode send(String method, Map<String, Object> params) {
            lastParams = params;
            return BotJson.mapper().createObjectNode().put("status", status);
        }

        @Override
        public JsonNode sendMultipart(String method, Map<String, Object> params, InputFile file) {
            return send(method, params);
        }

        @Override
        public byte[] download(String filePath) {
            return new byte[0];
        }

        @Override
        public void close() {
        }
    }
}
