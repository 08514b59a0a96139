package com.trailerlink.backend.modules.admin.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.trailerlink.backend.global.config.AdminProperties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class AdminBootstrapRunnerTest {

    @Mock
    AdminDirectoryService adminDirectoryService;

    @Test
    void missingBootstrapCredentialsCreateNobody() {
        AdminProperties properties = new AdminProperties(new AdminProperties.Bootstrap("root", " "), 10);

        new AdminBootstrapRunner(adminDirectoryService, properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(adminDirectoryService);
    }

    @Test
    void configuredBootstrapCreatesSuperAdmin() {
        AdminProperties properties = new AdminProperties(new AdminProperties.Bootstrap("root", "root-pass"), 10);

        new AdminBootstrapRunner(adminDirectoryService, properties).run(new DefaultApplicationArguments());

        verify(adminDirectoryService).bootstrap("root", "root-pass");
    }
}
