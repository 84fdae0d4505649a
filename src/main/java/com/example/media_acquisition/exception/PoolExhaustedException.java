package com.example.media_acquisition.exception;

public class PoolExhaustedException extends RuntimeException {
    private final String pool;

    public PoolExhaustedException(String pool, String message) {
        super(message);
        this.pool = pool;
    }

    public String getPool() {
        return pool;
    }
}
