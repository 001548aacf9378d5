package com.kmg.repost.service;

import com.kmg.repost.model.ActionOutcome;

/**
 * Performs the side-effecting action for one schedule target.
 * Implementations report every failure (missing configuration included) as a failed outcome instead of throwing.
 * The call may block for as long as the external system takes.
 */
@FunctionalInterface
public interface ActionExecutor {
    ActionOutcome execute(String target);
}
