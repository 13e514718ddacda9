package com.gentoro.tasktree.health;

public record CollectionStatus(boolean exists, long count) {}
