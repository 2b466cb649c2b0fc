package com.baskettecase.sqlgate.store;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the record store tables, parents before children
 */
@Slf4j
@Component("schemaInitializer")
@RequiredArgsConstructor
public class SchemaInitializer {

    private final AppUserRepository userRepository;
    private final WorkspaceRepository workspaceRepository;
    private final ExecutionLogRepository executionLogRepository;
    private final DatabaseCatalogRepository catalogRepository;

    @PostConstruct
    public void initialize() {
        log.info("🔧 Initializing record store schema...");
        try {
            userRepository.initializeTable();
            workspaceRepository.initializeTables();
            executionLogRepository.initializeTable();
            catalogRepository.initializeTable();
            log.info("✅ Record store schema ready");
        } catch (RuntimeException e) {
            log.error("❌ Failed to initialize record store schema", e);
            throw e;
        }
    }
}
