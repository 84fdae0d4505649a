package com.example.media_acquisition.dto;

import com.example.media_acquisition.util.BackendErrorClass;

public record BackendAttempt(String backend, BackendErrorClass classification, String reason) {
    @Override
    public String toString() {
        return backend + "[" + classification + "]: " + reason;
    }
}
