package com.trailerlink.backend.modules.admin.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.trailerlink.backend.global.config.AdminProperties;

/**
 * Ensures the configured super admin exists once the context is up.
 */
@Component
public class AdminBootstrapRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapRunner.class);

    private final AdminDirectoryService adminDirectoryService;
    private final AdminProperties adminProperties;

    public AdminBootstrapRunner(AdminDirectoryService adminDirectoryService, AdminProperties adminProperties) {
        this.adminDirectoryService = adminDirectoryService;
        this.adminProperties = adminProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        AdminProperties.Bootstrap bootstrap = adminProperties.bootstrap();
        if (bootstrap == null || !bootstrap.isConfigured()) {
            log.warn("app.admin.bootstrap.username/password not set - no initial admin created");
            return;
        }
        adminDirectoryService.bootstrap(bootstrap.username(), bootstrap.password());
    }
}
