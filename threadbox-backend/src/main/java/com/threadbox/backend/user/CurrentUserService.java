package com.threadbox.backend.user;

import com.threadbox.backend.shared.error.NotFoundException;
import com.threadbox.backend.shared.error.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the acting user the host authenticated. Authentication itself lives
 * outside this service; the host forwards the user id in {@link #USER_HEADER}.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserService {

    public static final String USER_HEADER = "X-User-Id";

    private final UserRepository userRepository;

    public User getCurrentUserOrThrow(Long userId) {
        if (userId == null) {
            throw new UnauthenticatedException("Unauthenticated");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }
}
