package com.threadbox.backend.thread;

import com.threadbox.backend.message.dto.MessageDto;
import com.threadbox.backend.thread.dto.ThreadNodeDto;
import com.threadbox.backend.user.CurrentUserService;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/threads")
@RequiredArgsConstructor
public class ThreadController {

    private final ThreadService threadService;
    private final CurrentUserService currentUserService;

    /** Whole thread containing the message, as a nested tree from the root. */
    @GetMapping("/{messageId}")
    public ThreadNodeDto thread(
            @PathVariable UUID messageId,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return threadService.threadTree(messageId, user);
    }

    @GetMapping("/{messageId}/replies")
    public List<MessageDto> allReplies(
            @PathVariable UUID messageId,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return threadService.allReplies(messageId, user);
    }

    @GetMapping("/{messageId}/replies/direct")
    public List<MessageDto> directReplies(
            @PathVariable UUID messageId,
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return threadService.directReplies(messageId, user);
    }
}
