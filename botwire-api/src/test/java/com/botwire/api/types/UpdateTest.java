package com.botwire.api.types;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateTest {

    private static Message textMessage(long chatId, String text) {
        Message m = new Message();
        m.setMessageId(1);
        m.setChat(Chat.builder().id(chatId).type("group").build());
        m.setFrom(User.builder().id(7).firstName("Ann").build());
        m.setText(text);
        return m;
    }

    @Nested
    class Construction {
        @Test
        void of_wrongPayloadType_rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> Update.of(1, UpdateKind.CALLBACK_QUERY, new Message()));
            assertThrows(NullPointerException.class, () -> Update.of(1, UpdateKind.MESSAGE, null));
        }

        @Test
        void of_sharedPayloadType_accepted() {
            Update u = Update.of(3, UpdateKind.CHAT_MEMBER, new ChatMemberUpdated());

            assertEquals(UpdateKind.CHAT_MEMBER, u.getKind());
            assertNull(u.getMessage());
        }

        @Test
        void kindLookupByWireName() {
            assertEquals(UpdateKind.EDITED_CHANNEL_POST, UpdateKind.fromWireName("edited_channel_post"));
            assertNull(UpdateKind.fromWireName("business_message"));
            assertTrue(UpdateKind.CHANNEL_POST.isMessageKind());
            assertFalse(UpdateKind.POLL.hasChat());
        }
    }

    @Nested
    class Accessors {
        @Test
        void message_chatAndFrom() {
            Update u = Update.message(10, textMessage(-5, "hi"));

            assertEquals(-5, u.getChat().getId());
            assertEquals(7, u.getFrom().getId());
            assertEquals(ChatType.GROUP, u.getChat().chatType());
        }

        @Test
        void callback_chatComesFromAttachedMessage() {
            CallbackQuery cb = new CallbackQuery();
            cb.setFrom(User.builder().id(9).build());
            cb.setMessage(textMessage(42, "menu"));

            Update u = Update.of(11, UpdateKind.CALLBACK_QUERY, cb);

            assertEquals(42, u.getChat().getId());
            assertEquals(9, u.getFrom().getId());
            assertSame(cb, u.getCallbackQuery());
            assertNull(u.getInlineQuery());
        }

        @Test
        void inlineCallback_hasNoChat() {
            CallbackQuery cb = new CallbackQuery();
            cb.setInlineMessageId("abc");

            assertNull(Update.of(12, UpdateKind.CALLBACK_QUERY, cb).getChat());
        }

        @Test
        void poll_hasNoChatOrSender() {
            Update u = Update.of(13, UpdateKind.POLL, new Poll());

            assertNull(u.getChat());
            assertNull(u.getFrom());
            assertNotNull(u.getPayload(Poll.class));
        }
    }

    @Nested
    class Content {
        @Test
        void textWinsOverOtherFields() {
            Message m = textMessage(1, "caption-like");
            m.setLocation(new Location());

            assertEquals(ContentType.TEXT, m.getContentType());
        }

        @Test
        void emptyPhotoListIsNotPhoto() {
            Message m = new Message();
            m.setPhoto(List.of());
            m.setSticker(new MediaFile());

            assertEquals(ContentType.STICKER, m.getContentType());
        }

        @Test
        void nothingRecognised_unknown() {
            assertEquals(ContentType.UNKNOWN, new Message().getContentType());
        }

        @Test
        void captionFallback() {
            Message m = new Message();
            m.setCaption("look");

            assertEquals("look", m.textOrCaption());
            assertFalse(m.isForwarded());
            m.setForwardDate(100L);
            assertTrue(m.isForwarded());
        }

        @Test
        void tagLookupIgnoresCase() {
            assertEquals(ContentType.NEW_CHAT_MEMBERS, ContentType.fromTag("New_Chat_Members"));
            assertNull(ContentType.fromTag("hologram"));
        }
    }
}
