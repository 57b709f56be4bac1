package com.archforge.core.planner;

/**
 * Artifact flavour within a {@link TaskCategory}.
 */
public enum TaskKind {
    MODEL(TaskCategory.BACKEND, 1),
    SERVICE(TaskCategory.BACKEND, 2),
    REPOSITORY(TaskCategory.BACKEND, 2),
    CONTROLLER(TaskCategory.BACKEND, 3),
    MIDDLEWARE(TaskCategory.BACKEND, 3),
    UTILITY(TaskCategory.BACKEND, 1),
    ROUTE(TaskCategory.BACKEND, 4),
    SERVER_ENTRY(TaskCategory.BACKEND, 5),

    COMPONENT(TaskCategory.FRONTEND, 5),
    PAGE(TaskCategory.FRONTEND, 6),
    HOOK(TaskCategory.FRONTEND, 5),
    ROUTER(TaskCategory.FRONTEND, 7),

    SHARED_TYPES(TaskCategory.SHARED, 1),
    SHARED_CONSTANTS(TaskCategory.SHARED, 1),
    SHARED_UTILS(TaskCategory.SHARED, 1),

    UNIT_TEST(TaskCategory.TEST, 8),
    INTEGRATION_TEST(TaskCategory.TEST, 8),
    E2E_TEST(TaskCategory.TEST, 9),

    BACKEND_PACKAGE(TaskCategory.BUILD, 9),
    FRONTEND_PACKAGE(TaskCategory.BUILD, 9),
    TYPESCRIPT_CONFIG(TaskCategory.BUILD, 9),
    BUILD_SCRIPTS(TaskCategory.BUILD, 10),

    DEPLOY_PACKAGE(TaskCategory.DEPLOY, 11),
    DEPLOY_FUNCTION(TaskCategory.DEPLOY, 12),
    DEPLOY_STATIC_SITE(TaskCategory.DEPLOY, 12);

    private final TaskCategory category;
    private final int defaultPriority;

    TaskKind(TaskCategory category, int defaultPriority) {
        this.category = category;
        this.defaultPriority = defaultPriority;
    }

    public TaskCategory category() {
        return category;
    }

    /**
     * Advisory priority; lower runs earlier when planners choose to sort by it.
     *
     * @return default priority
     */
    public int defaultPriority() {
        return defaultPriority;
    }
}
