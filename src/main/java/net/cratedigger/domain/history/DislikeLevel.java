package net.cratedigger.domain.history;

/**
 * Strength of a recorded dislike. Every level keeps the item out of future batches;
 * the level only changes how exclusion prompts phrase it.
 */
public enum DislikeLevel {
    NORMAL,
    STRONG,
    NEVER_AGAIN
}
