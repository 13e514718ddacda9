package com.gentoro.tasktree.model;

/**
 * Directive text by which a parent declares a child task.
 *
 * @param text raw fragment as found in the parent's outline
 * @param mode agent mode requested for the child, may be null
 * @param ordinal position among the parent's fragments, starting at 0
 */
public record DelegationFragment(String text, String mode, int ordinal) {}
