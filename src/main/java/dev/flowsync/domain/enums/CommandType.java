package dev.flowsync.domain.enums;

/**
 * Structured command kinds produced by the command interpreter.
 */
public enum CommandType {
    ADD_BLOCK(Category.EDIT),
    DELETE_BLOCK(Category.EDIT),
    CONNECT_BLOCKS(Category.EDIT),
    MODIFY_BLOCK(Category.EDIT),
    EXECUTE_WORKFLOW(Category.EXECUTION),
    PAUSE(Category.EXECUTION),
    RESUME(Category.EXECUTION),
    STOP(Category.EXECUTION),
    RETRY(Category.EXECUTION),
    SKIP(Category.EXECUTION),
    DEBUG(Category.EXECUTION),
    GET_STATUS(Category.QUERY);

    public enum Category { EDIT, EXECUTION, QUERY }

    private final Category category;

    CommandType(Category category) { this.category = category; }

    public Category category() { return category; }
}
