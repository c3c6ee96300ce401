package eu.virtualparadox.lobbymap.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for asynchronously submitted document ingestions.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
