package com.threadbox.backend.user;

import com.threadbox.backend.history.MessageHistoryRepository;
import com.threadbox.backend.history.MessageHistoryService;
import com.threadbox.backend.message.Message;
import com.threadbox.backend.message.MessageRepository;
import com.threadbox.backend.message.MessageService;
import com.threadbox.backend.notification.NotificationRepository;
import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.user.dto.UserDataSummary;
import com.threadbox.backend.user.dto.UserDeletionResult;
import com.threadbox.backend.util.TestCleanupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class UserDeletionServiceTest {

    @Autowired private UserDeletionService userDeletionService;
    @Autowired private MessageService messageService;
    @Autowired private MessageHistoryService historyService;
    @Autowired private UserRepository userRepository;
    @Autowired private MessageRepository messageRepository;
    @Autowired private MessageHistoryRepository historyRepository;
    @Autowired private NotificationRepository notificationRepository;
    @Autowired private TestCleanupService cleanup;

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
    void deletingUserShouldLeaveNoReferencesBehind() {
        Message root = messageService.create(alice, bob.getId(), "root", null);
        Message reply = messageService.create(bob, alice.getId(), "reply", root.getId());
        messageService.edit(reply.getId(), bob, "reply, edited", null);
        // bob pulls carol into alice's thread; the reply goes with the thread
        messageService.create(bob, carol.getId(), "fyi", root.getId());
        Message survivor = messageService.create(carol, bob.getId(), "unrelated", null);
        historyService.recordEdit(survivor, "unrelated", "unrelated!", alice, "moderation");

        UserDeletionResult result = userDeletionService.deleteUser(alice.getId());

        assertEquals(3, result.messagesDeleted());
        assertEquals(1, result.editHistoriesDeleted());
        assertFalse(userRepository.existsById(alice.getId()));
        assertEquals(0, messageRepository.countBySender_Id(alice.getId()));
        assertEquals(0, messageRepository.countByReceiver_Id(alice.getId()));
        assertEquals(0, notificationRepository.countByRecipient_Id(alice.getId()));
        assertEquals(0, historyRepository.countByEditedBy_Id(alice.getId()));

        assertEquals(1, messageRepository.count());
        assertTrue(messageRepository.existsById(survivor.getId()));
        assertEquals(1, notificationRepository.countByRecipient_Id(bob.getId()));
        assertEquals(0, notificationRepository.countByRecipient_Id(carol.getId()));
        assertTrue(userRepository.existsById(bob.getId()));
        assertTrue(userRepository.existsById(carol.getId()));
    }

    @Test
    void dataSummaryShouldCountBothRoles() {
        Message root = messageService.create(alice, bob.getId(), "hello", null);
        messageService.create(bob, alice.getId(), "hi back", root.getId());
        messageService.create(carol, alice.getId(), "hey alice", null);
        messageService.edit(root.getId(), alice, "hello there", null);

        UserDataSummary summary = userDeletionService.dataSummary(alice.getId());

        assertEquals(1, summary.sentMessages());
        assertEquals(2, summary.receivedMessages());
        assertEquals(3, summary.totalMessages());
        assertEquals(2, summary.notifications());
        assertEquals(1, summary.editHistoriesAuthored());
        assertEquals(0, summary.historiesOnReceivedMessages());
    }

    @Test
    void deletingUnknownUserShouldFail() {
        assertThrows(NotFoundException.class, () -> userDeletionService.deleteUser(-1L));
    }
}
