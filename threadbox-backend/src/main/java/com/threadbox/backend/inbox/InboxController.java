package com.threadbox.backend.inbox;

import com.threadbox.backend.inbox.dto.InboxMessageDto;
import com.threadbox.backend.user.CurrentUserService;
import com.threadbox.backend.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/inbox")
@RequiredArgsConstructor
public class InboxController {

    private final UnreadMessageService unreadMessageService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public List<InboxMessageDto> inbox(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return unreadMessageService.inbox(user);
    }

    @GetMapping("/unread")
    public List<InboxMessageDto> unread(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return unreadMessageService.unreadFor(user);
    }

    @GetMapping("/unread/count")
    public Map<String, Long> unreadCount(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return Map.of("unreadCount", unreadMessageService.unreadCount(user));
    }

    @GetMapping("/unread/threads")
    public List<InboxMessageDto> unreadThreads(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return unreadMessageService.unreadThreadRoots(user);
    }
}
