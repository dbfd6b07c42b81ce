package com.threadbox.backend.message;

import com.threadbox.backend.history.MessageHistoryRepository;
import com.threadbox.backend.history.MessageHistoryService;
import com.threadbox.backend.history.dto.MessageHistoryDto;
import com.threadbox.backend.inbox.UnreadMessageService;
import com.threadbox.backend.notification.Notification;
import com.threadbox.backend.notification.NotificationRepository;
import com.threadbox.backend.notification.NotificationType;
import com.threadbox.backend.shared.error.InvalidParentException;
import com.threadbox.backend.shared.error.PermissionDeniedException;
import com.threadbox.backend.thread.ThreadService;
import com.threadbox.backend.user.User;
import com.threadbox.backend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MessageLifecycleIntegrationTest {

    @Autowired private MessageService messageService;
    @Autowired private ThreadService threadService;
    @Autowired private MessageHistoryService historyService;
    @Autowired private UnreadMessageService unreadMessageService;
    @Autowired private MessageRepository messageRepository;
    @Autowired private MessageHistoryRepository historyRepository;
    @Autowired private NotificationRepository notificationRepository;
    @Autowired private TestCleanupService cleanup;
    @Autowired private TransactionTemplate transactionTemplate;

    private User alice;
    private User bob;
    private User carol;

    @BeforeEach
    void setUp() {
        cleanup.cleanAll();
        alice = cleanup.createUser("alice");
        bob = cleanup.createUser("bob");
        carol = cleanup.createUser("carol");
    }

    @Test
    void threeLevelThreadShouldShareRootAndReportDepths() {
        Message root = messageService.create(alice, bob.getId(), "root", null);
        Message reply1 = messageService.create(bob, alice.getId(), "reply1", root.getId());
        Message reply2 = messageService.create(alice, bob.getId(), "reply2", reply1.getId());

        transactionTemplate.executeWithoutResult(tx -> {
            Message loaded = messageRepository.findById(reply2.getId()).orElseThrow();
            assertEquals(2, threadService.depthOf(loaded));
            assertEquals(root.getId(), threadService.rootOf(loaded).getId());

            Message loadedRoot = messageRepository.findById(root.getId()).orElseThrow();
            assertEquals(0, threadService.depthOf(loadedRoot));
            assertEquals(2, threadService.replyCount(loadedRoot));
            assertEquals(3, threadService.threadMessages(loaded).size());
            assertEquals(List.of(reply1.getId()),
                    threadService.directReplies(loadedRoot).stream().map(Message::getId).toList());
        });
    }

    @Test
    void editShouldRecordHistoryAndNotifyReceiver() {
        Message message = messageService.create(alice, bob.getId(), "hello", null);

        messageService.edit(message.getId(), alice, "hello world", null);

        Message stored = messageRepository.findById(message.getId()).orElseThrow();
        assertEquals("hello world", stored.getContent());
        assertTrue(stored.isEdited());
        assertEquals(1, stored.getEditCount());

        List<MessageHistoryDto> history = historyService.historyFor(message.getId(), bob);
        assertEquals(1, history.size());
        assertEquals("hello", history.get(0).oldContent());
        assertEquals("hello world", history.get(0).newContent());
        assertEquals("Content expanded by 6 characters", history.get(0).editSummary());

        List<Notification> notifications = notificationRepository.findByMessage_IdOrderByCreatedAtAsc(message.getId());
        assertEquals(2, notifications.size());
        assertEquals(NotificationType.NEW_MESSAGE, notifications.get(0).getType());
        assertEquals(NotificationType.EDIT, notifications.get(1).getType());
        assertEquals(2, notificationRepository.countByRecipient_Id(bob.getId()));
    }

    @Test
    void editCountShouldEqualNumberOfHistoryRows() {
        Message message = messageService.create(alice, bob.getId(), "v1", null);

        messageService.edit(message.getId(), alice, "v2", null);
        messageService.edit(message.getId(), alice, "v2", null);
        messageService.edit(message.getId(), alice, "v3", "second try");

        Message stored = messageRepository.findById(message.getId()).orElseThrow();
        assertEquals(2, stored.getEditCount());
        assertEquals(2, historyRepository.countByMessage_Id(message.getId()));
        assertEquals(3, notificationRepository.findByMessage_IdOrderByCreatedAtAsc(message.getId()).size());
    }

    @Test
    void unreadCountShouldFollowMarkRead() {
        Message first = messageService.create(alice, bob.getId(), "one", null);
        messageService.create(alice, bob.getId(), "two", null);
        messageService.create(carol, bob.getId(), "three", null);
        Message fourth = messageService.create(alice, bob.getId(), "four", null);
        messageService.markRead(fourth.getId(), bob);

        assertEquals(3, unreadMessageService.unreadCount(bob));
        assertEquals(3, unreadMessageService.unreadFor(bob).size());

        messageService.markRead(first.getId(), bob);

        assertEquals(2, unreadMessageService.unreadCount(bob));
        assertTrue(notificationRepository.findByMessage_IdOrderByCreatedAtAsc(first.getId())
                .stream().allMatch(Notification::isRead));

        // marking again changes nothing
        messageService.markRead(first.getId(), bob);
        assertEquals(2, unreadMessageService.unreadCount(bob));
    }

    @Test
    void markAllReadShouldPropagateToNotifications() {
        messageService.create(alice, bob.getId(), "one", null);
        messageService.create(carol, bob.getId(), "two", null);

        assertEquals(2, messageService.markAllRead(bob));

        assertEquals(0, unreadMessageService.unreadCount(bob));
        assertEquals(0, notificationRepository.countByRecipient_IdAndReadFalse(bob.getId()));
        assertEquals(0, messageService.markAllRead(bob));
    }

    @Test
    void deleteShouldRemoveWholeSubtreeWithDependents() {
        Message root = messageService.create(alice, bob.getId(), "root", null);
        Message reply1 = messageService.create(bob, alice.getId(), "reply1", root.getId());
        Message reply2 = messageService.create(alice, bob.getId(), "reply2", reply1.getId());
        messageService.edit(reply1.getId(), bob, "reply1 edited", null);
        Message other = messageService.create(alice, bob.getId(), "unrelated", null);

        int deleted = messageService.delete(root.getId(), alice);

        assertEquals(3, deleted);
        for (UUID id : List.of(root.getId(), reply1.getId(), reply2.getId())) {
            assertFalse(messageRepository.existsById(id));
            assertTrue(notificationRepository.findByMessage_IdOrderByCreatedAtAsc(id).isEmpty());
            assertEquals(0, historyRepository.countByMessage_Id(id));
        }
        assertTrue(messageRepository.existsById(other.getId()));
    }

    @Test
    void outsiderShouldNotReplyOrDelete() {
        Message root = messageService.create(alice, bob.getId(), "private", null);

        assertThrows(PermissionDeniedException.class,
                () -> messageService.create(carol, alice.getId(), "hi", root.getId()));
        assertThrows(PermissionDeniedException.class, () -> messageService.delete(root.getId(), bob));
        assertEquals(1, messageRepository.count());
    }

    @Test
    void replyToMissingParentShouldFail() {
        assertThrows(InvalidParentException.class,
                () -> messageService.create(alice, bob.getId(), "orphan", UUID.randomUUID()));
        assertEquals(0, messageRepository.count());
        assertEquals(0, notificationRepository.count());
    }

    @Test
    void rootParticipantMayReplyDeepInThread() {
        Message root = messageService.create(alice, bob.getId(), "root", null);
        Message toCarol = messageService.create(bob, carol.getId(), "looping carol in", root.getId());

        Message reply = messageService.create(alice, carol.getId(), "hi carol", toCarol.getId());

        assertEquals(toCarol.getId(), reply.getParentMessageId());
    }
}
