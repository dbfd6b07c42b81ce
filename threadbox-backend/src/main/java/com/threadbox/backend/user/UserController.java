package com.threadbox.backend.user;

import com.threadbox.backend.user.dto.UserDataSummary;
import com.threadbox.backend.user.dto.UserDeletionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserDeletionService userDeletionService;
    private final CurrentUserService currentUserService;

    /** Counts of the data an account deletion would remove. */
    @GetMapping("/me/data-summary")
    public UserDataSummary dataSummary(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return userDeletionService.dataSummary(user.getId());
    }

    @DeleteMapping("/me")
    public UserDeletionResult deleteAccount(
            @RequestHeader(value = CurrentUserService.USER_HEADER, required = false) Long userId
    ) {
        User user = currentUserService.getCurrentUserOrThrow(userId);
        return userDeletionService.deleteUser(user.getId());
    }
}
