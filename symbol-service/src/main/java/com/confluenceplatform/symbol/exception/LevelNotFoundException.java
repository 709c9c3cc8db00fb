package com.confluenceplatform.symbol.exception;

public class LevelNotFoundException extends RuntimeException {
    private final long levelId;

    public LevelNotFoundException(long levelId) {
        super("Level " + levelId + " does not exist");
        this.levelId = levelId;
    }

    public long getLevelId() {
        return levelId;
    }
}
