package com.trailerlink.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.trailerlink.backend.global.error.ProblemException;
import com.trailerlink.backend.modules.admin.domain.AdminAccount;
import com.trailerlink.backend.modules.admin.domain.AdminRole;
import com.trailerlink.backend.modules.admin.infrastructure.persistence.AdminAccountRepository;

@Service
@Transactional
public class AdminDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(AdminDirectoryService.class);

    public static final String CODE_FORBIDDEN = "admin.forbidden";
    public static final String CODE_USERNAME_CONFLICT = "admin.username_conflict";
    public static final String CODE_INVALID_INPUT = "admin.invalid_input";

    static final int MAX_USERNAME_LENGTH = 64;

    private final AdminAccountRepository adminAccountRepository;
    private final CredentialHasher credentialHasher;
    private final Clock clock;

    public AdminDirectoryService(
            AdminAccountRepository adminAccountRepository,
            CredentialHasher credentialHasher,
            Clock clock
    ) {
        this.adminAccountRepository = adminAccountRepository;
        this.credentialHasher = credentialHasher;
        this.clock = clock;
    }

    /**
     * Creates {@code username} as a super admin unless it already exists.
     *
     * @return {@code true} if a row was created
     */
    public boolean bootstrap(@NonNull String username, @NonNull String password) {
        String normalized = requireUsername(username);
        requirePassword(password);
        if (adminAccountRepository.existsById(normalized)) {
            log.info("Super admin \"{}\" already exists", normalized);
            return false;
        }
        // a concurrent bootstrap may win between the check and the insert; ON CONFLICT keeps this a no-op
        boolean created = insert(normalized, password, AdminRole.SUPER);
        if (created) {
            log.info("Super admin \"{}\" created", normalized);
        } else {
            log.info("Super admin \"{}\" already exists", normalized);
        }
        return created;
    }

    @Transactional(readOnly = true)
    public AdminVerification verify(String username, String password) {
        if (!StringUtils.hasText(username) || password == null) {
            return AdminVerification.invalid();
        }
        return adminAccountRepository.findById(username.trim())
                .filter(admin -> credentialHasher.verify(password, admin.getPasswordHash()))
                .map(admin -> AdminVerification.of(admin.getRole(), admin.getUsername()))
                .orElseGet(AdminVerification::invalid);
    }

    /**
     * Creates a secondary admin on behalf of {@code actorUsername}, who must be a super admin.
     */
    public void addSecondary(String actorUsername, String newUsername, String newPassword) {
        boolean actorIsSuper = StringUtils.hasText(actorUsername)
                && adminAccountRepository.findById(actorUsername.trim())
                        .map(AdminAccount::isSuper)
                        .orElse(false);
        if (!actorIsSuper) {
            throw new ProblemException(HttpStatus.FORBIDDEN, CODE_FORBIDDEN,
                    "Only super admins can add new administrators");
        }

        String normalized = requireUsername(newUsername);
        requirePassword(newPassword);
        if (adminAccountRepository.existsById(normalized) || !insert(normalized, newPassword, AdminRole.SECONDARY)) {
            throw new ProblemException(HttpStatus.CONFLICT, CODE_USERNAME_CONFLICT,
                    "Username \"" + normalized + "\" already exists");
        }
        log.info("Secondary admin \"{}\" created by \"{}\"", normalized, actorUsername.trim());
    }

    /**
     * All admins, newest first.
     */
    @Transactional(readOnly = true)
    public List<AdminAccount> list() {
        return adminAccountRepository.findAllByOrderByCreatedAtDescUsernameAsc();
    }

    private boolean insert(String username, String password, AdminRole role) {
        int inserted = adminAccountRepository.insertIfAbsent(
                username,
                credentialHasher.hash(password),
                role.name(),
                OffsetDateTime.now(clock)
        );
        return inserted == 1;
    }

    private static String requireUsername(String username) {
        if (!StringUtils.hasText(username)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT, "Username is required");
        }
        String trimmed = username.trim();
        if (trimmed.length() > MAX_USERNAME_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT,
                    "Username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static void requirePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT, "Password is required");
        }
    }
}
