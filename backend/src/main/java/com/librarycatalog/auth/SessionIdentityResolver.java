package com.librarycatalog.auth;

import com.librarycatalog.exception.SessionSerializationException;
import com.librarycatalog.repo.UserRepository;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Translates between the session reference and the stored user on every
 * request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionIdentityResolver {

    public static final String SESSION_ATTRIBUTE = SessionReference.class.getName();

    private final UserRepository userRepository;
    private final PrincipalNormalizer principalNormalizer;

    /**
     * @throws SessionSerializationException if the user was never stored
     */
    public SessionReference serialize(UserIdentity user) {
        if (user == null || !user.isPersisted()) {
            throw new SessionSerializationException("Cannot bind a session to a user without an id");
        }
        return new SessionReference(user.getId().toString());
    }

    /**
     * Empty when the referenced user no longer exists or the reference is
     * not a valid id. Callers treat empty as anonymous.
     */
    public Optional<SafeUser> deserialize(SessionReference reference) {
        if (reference == null || reference.userId() == null) {
            return Optional.empty();
        }
        long id;
        try {
            id = Long.parseLong(reference.userId());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed session reference {}", reference.userId());
            return Optional.empty();
        }
        return userRepository.findById(id)
                .map(principalNormalizer::fromStoredDocument)
                .map(principalNormalizer::toSafeView);
    }

    public void bind(HttpSession session, SessionReference reference) {
        session.setAttribute(SESSION_ATTRIBUTE, reference);
    }

    public Optional<SessionReference> boundReference(HttpSession session) {
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(SESSION_ATTRIBUTE);
        return value instanceof SessionReference reference ? Optional.of(reference) : Optional.empty();
    }

    public void unbind(HttpSession session) {
        session.removeAttribute(SESSION_ATTRIBUTE);
    }
}
